package com.gentoro.gscmcp.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One input parameter of a tool, rendered as a JSON-Schema property. */
public class ToolProperty {
  public enum Type {
    STRING,
    INTEGER,
    NUMBER
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final List<String> enumValues;
  private final Number minimum;
  private final Number maximum;
  private final Object defaultValue;

  private ToolProperty(Builder b) {
    this.name = b.name;
    this.description = b.description;
    this.required = b.required;
    this.type = b.type;
    this.enumValues = b.enumValues;
    this.minimum = b.minimum;
    this.maximum = b.maximum;
    this.defaultValue = b.defaultValue;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public List<String> getEnumValues() {
    return enumValues;
  }

  /** JSON-Schema fragment for this property. */
  public Map<String, Object> toSchema() {
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", type.name().toLowerCase());
    if (description != null) schema.put("description", description);
    if (enumValues != null && !enumValues.isEmpty()) schema.put("enum", enumValues);
    if (minimum != null) schema.put("minimum", minimum);
    if (maximum != null) schema.put("maximum", maximum);
    if (defaultValue != null) schema.put("default", defaultValue);
    return schema;
  }

  public static Builder string(String name) {
    return new Builder(name, Type.STRING);
  }

  public static Builder integer(String name) {
    return new Builder(name, Type.INTEGER);
  }

  public static Builder number(String name) {
    return new Builder(name, Type.NUMBER);
  }

  public static final class Builder {
    private final String name;
    private final Type type;
    private String description;
    private boolean required;
    private List<String> enumValues;
    private Number minimum;
    private Number maximum;
    private Object defaultValue;

    private Builder(String name, Type type) {
      this.name = name;
      this.type = type;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required() {
      this.required = true;
      return this;
    }

    public Builder enumValues(List<String> values) {
      this.enumValues = List.copyOf(values);
      return this;
    }

    public Builder minimum(Number minimum) {
      this.minimum = minimum;
      return this;
    }

    public Builder maximum(Number maximum) {
      this.maximum = maximum;
      return this;
    }

    public Builder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public ToolProperty build() {
      return new ToolProperty(this);
    }
  }
}
