package com.gentoro.gscmcp.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.gscmcp.exception.SerializationException;

public class JacksonUtility {

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // Search Console answers carry far more fields than we model
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return JSON_MAPPER.readTree(json);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse JSON content", e);
    }
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException("Failed to deserialize JSON into " + type.getSimpleName(), e);
    }
  }
}
