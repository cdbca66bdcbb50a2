package com.gentoro.gscmcp.searchconsole;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gscmcp.exception.NetworkException;
import com.gentoro.gscmcp.exception.ReportingApiException;
import com.gentoro.gscmcp.exception.SerializationException;
import com.gentoro.gscmcp.exception.TokenRefreshException;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link SearchConsoleClient} over plain REST calls. The {@link OkHttpClient} given is expected to
 * authenticate requests itself (see {@code AuthenticatedClient}).
 */
public class OkHttpSearchConsoleClient implements SearchConsoleClient {
  private static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final SearchConsoleEndpoints endpoints;

  public OkHttpSearchConsoleClient(OkHttpClient httpClient, SearchConsoleEndpoints endpoints) {
    this.httpClient = httpClient;
    this.endpoints = endpoints;
  }

  @Override
  public JsonNode listSites() {
    return execute(new Request.Builder().url(webmasters().addPathSegment("sites").build()).get());
  }

  @Override
  public SearchAnalyticsResponse query(String siteUrl, SearchAnalyticsRequest request) {
    HttpUrl url = site(siteUrl).addPathSegment("searchAnalytics").addPathSegment("query").build();
    JsonNode json = execute(new Request.Builder().url(url).post(jsonBody(request)));
    try {
      return JacksonUtility.getJsonMapper().treeToValue(json, SearchAnalyticsResponse.class);
    } catch (Exception e) {
      throw new SerializationException("Unexpected Search Analytics answer", e);
    }
  }

  @Override
  public JsonNode inspectUrl(String siteUrl, String inspectionUrl, String languageCode) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("inspectionUrl", inspectionUrl);
    body.put("siteUrl", siteUrl);
    if (languageCode != null) body.put("languageCode", languageCode);
    HttpUrl url =
        HttpUrl.get(endpoints.searchConsoleUrl())
            .newBuilder()
            .addPathSegment("urlInspection")
            .addPathSegment("index:inspect")
            .build();
    return execute(new Request.Builder().url(url).post(jsonBody(body)));
  }

  @Override
  public JsonNode publishUrlNotification(String url, String type) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("url", url);
    body.put("type", type);
    HttpUrl target =
        HttpUrl.get(endpoints.indexingUrl())
            .newBuilder()
            .addPathSegment("urlNotifications:publish")
            .build();
    return execute(new Request.Builder().url(target).post(jsonBody(body)));
  }

  @Override
  public JsonNode listSitemaps(String siteUrl) {
    return execute(new Request.Builder().url(site(siteUrl).addPathSegment("sitemaps").build()).get());
  }

  @Override
  public void submitSitemap(String siteUrl, String feedpath) {
    HttpUrl url = site(siteUrl).addPathSegment("sitemaps").addPathSegment(feedpath).build();
    execute(new Request.Builder().url(url).put(RequestBody.create(new byte[0], null)));
  }

  private HttpUrl.Builder webmasters() {
    return HttpUrl.get(endpoints.webmastersUrl()).newBuilder();
  }

  /** Site URLs are a single, fully escaped path segment: {@code sites/https:%2F%2Fexample.com%2F}. */
  private HttpUrl.Builder site(String siteUrl) {
    return webmasters().addPathSegment("sites").addPathSegment(siteUrl);
  }

  private static RequestBody jsonBody(Object body) {
    return RequestBody.create(JacksonUtility.toJson(body), JSON);
  }

  private JsonNode execute(Request.Builder builder) {
    Request request = builder.header("Accept", "application/json").build();
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String content = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new ReportingApiException(response.code(), errorMessage(response.code(), content));
      }
      if (content.isBlank()) {
        return JacksonUtility.getJsonMapper().createObjectNode();
      }
      return JacksonUtility.readTree(content);
    } catch (IOException e) {
      if (e.getCause() instanceof TokenRefreshException refreshFailure) {
        throw refreshFailure;
      }
      throw new NetworkException(
          "Request to " + request.url().host() + request.url().encodedPath() + " failed", e);
    }
  }

  /** Google APIs answer {@code {"error": {"code": 403, "message": "..."}}}. */
  static String errorMessage(int status, String content) {
    try {
      JsonNode error = JacksonUtility.readTree(content).path("error");
      if (error.hasNonNull("message")) {
        return error.get("message").asText();
      }
      if (error.isTextual()) {
        return error.asText();
      }
    } catch (SerializationException ignored) {
      // not JSON, fall through
    }
    return "Request failed with HTTP " + status;
  }
}
