package com.gentoro.gscmcp.searchconsole;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.account.AccountRegistry;
import com.gentoro.gscmcp.auth.AuthenticatedClientCache;
import com.gentoro.gscmcp.auth.TokenRefresher;
import com.gentoro.gscmcp.exception.GscMcpErrorCode;
import com.gentoro.gscmcp.exception.IdentityProviderException;
import com.gentoro.gscmcp.exception.ReportingApiException;
import com.gentoro.gscmcp.exception.TokenRefreshException;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.time.Clock;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpSearchConsoleClientTest {

  private MockWebServer server;
  private OkHttpSearchConsoleClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    SearchConsoleEndpoints endpoints =
        new SearchConsoleEndpoints(
            server.url("/webmasters/v3").toString(),
            server.url("/v1").toString(),
            server.url("/indexing/v3").toString());
    client = new OkHttpSearchConsoleClient(new OkHttpClient(), endpoints);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private static MockResponse json(String body) {
    return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
  }

  @Test
  void queryPostsRequestToEscapedSitePath() throws Exception {
    server.enqueue(
        json(
            "{\"rows\":[{\"keys\":[\"shoes\",\"https://www.example.com/a\"],\"clicks\":20,"
                + "\"impressions\":1000,\"ctr\":0.02,\"position\":6.04}],"
                + "\"responseAggregationType\":\"byProperty\"}"));

    SearchAnalyticsRequest request =
        SearchAnalyticsRequest.builder()
            .startDate("2024-01-01")
            .endDate("2024-01-31")
            .dimensions(List.of("query", "page"))
            .rowLimit(10)
            .dataState("all")
            .dimensionFilterGroups(
                List.of(
                    DimensionFilterGroup.and(
                        List.of(new DimensionFilter("page", "contains", "/blog/")))))
            .build();
    SearchAnalyticsResponse response = client.query("https://www.example.com/", request);

    assertEquals(1, response.getRows().size());
    SearchAnalyticsRow row = response.getRows().get(0);
    assertEquals("shoes", row.key(0));
    assertEquals(20, row.getClicks());
    assertEquals(0.02, row.getCtr(), 1e-9);

    RecordedRequest recorded = server.takeRequest();
    assertEquals("POST", recorded.getMethod());
    assertEquals(
        "/webmasters/v3/sites/https:%2F%2Fwww.example.com%2F/searchAnalytics/query",
        recorded.getPath());
    JsonNode body = JacksonUtility.readTree(recorded.getBody().readUtf8());
    assertEquals("2024-01-01", body.get("startDate").asText());
    assertEquals(10, body.get("rowLimit").asInt());
    assertFalse(body.has("startRow"));
    assertEquals("and", body.at("/dimensionFilterGroups/0/groupType").asText());
    assertEquals("page", body.at("/dimensionFilterGroups/0/filters/0/dimension").asText());
  }

  @Test
  void emptyAnswerHasNoRows() {
    server.enqueue(json("{\"responseAggregationType\":\"auto\"}"));

    SearchAnalyticsResponse response =
        client.query(
            "sc-domain:example.com",
            SearchAnalyticsRequest.builder().startDate("2024-01-01").endDate("2024-01-02").build());

    assertNotNull(response.getRows());
    assertTrue(response.getRows().isEmpty());
  }

  @Test
  void permissionDeniedAnswerCarriesApiMessage() {
    server.enqueue(
        json(
                "{\"error\":{\"code\":403,\"message\":\"User does not have sufficient permission for site 'https://www.example.com/'.\"}}")
            .setResponseCode(403));

    ReportingApiException ex =
        assertThrows(ReportingApiException.class, () -> client.listSitemaps("https://www.example.com/"));
    assertEquals(403, ex.getStatus());
    assertTrue(ex.isPermissionError());
    assertEquals(GscMcpErrorCode.PERMISSION_DENIED, ex.getCode());
    assertTrue(ex.getMessage().startsWith("User does not have sufficient permission"));
  }

  @Test
  void serverErrorIsNotAPermissionError() {
    server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

    ReportingApiException ex = assertThrows(ReportingApiException.class, client::listSites);
    assertFalse(ex.isPermissionError());
    assertEquals(GscMcpErrorCode.EXECUTION_ERROR, ex.getCode());
    assertEquals("Request failed with HTTP 500", ex.getMessage());
  }

  @Test
  void submitSitemapPutsFeedpathAsSegment() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    client.submitSitemap("sc-domain:example.com", "https://example.com/sitemap.xml");

    RecordedRequest recorded = server.takeRequest();
    assertEquals("PUT", recorded.getMethod());
    assertEquals(
        "/webmasters/v3/sites/sc-domain:example.com/sitemaps/https:%2F%2Fexample.com%2Fsitemap.xml",
        recorded.getPath());
  }

  @Test
  void inspectUrlPostsInspectionRequest() throws Exception {
    server.enqueue(json("{\"inspectionResult\":{\"indexStatusResult\":{\"verdict\":\"PASS\"}}}"));

    JsonNode result =
        client.inspectUrl("sc-domain:example.com", "https://example.com/page", "en-US");

    assertEquals("PASS", result.at("/inspectionResult/indexStatusResult/verdict").asText());
    RecordedRequest recorded = server.takeRequest();
    assertEquals("/v1/urlInspection/index:inspect", recorded.getPath());
    JsonNode body = JacksonUtility.readTree(recorded.getBody().readUtf8());
    assertEquals("https://example.com/page", body.get("inspectionUrl").asText());
    assertEquals("sc-domain:example.com", body.get("siteUrl").asText());
    assertEquals("en-US", body.get("languageCode").asText());
  }

  @Test
  void publishUrlNotificationPostsUrlAndType() throws Exception {
    server.enqueue(json("{\"urlNotificationMetadata\":{\"url\":\"https://example.com/p\"}}"));

    client.publishUrlNotification("https://example.com/p", "URL_DELETED");

    RecordedRequest recorded = server.takeRequest();
    assertEquals("/indexing/v3/urlNotifications:publish", recorded.getPath());
    JsonNode body = JacksonUtility.readTree(recorded.getBody().readUtf8());
    assertEquals("URL_DELETED", body.get("type").asText());
  }

  @Test
  void errorMessagePrefersGoogleErrorEnvelope() {
    assertEquals(
        "quota exceeded",
        OkHttpSearchConsoleClient.errorMessage(429, "{\"error\":{\"message\":\"quota exceeded\"}}"));
    assertEquals("invalid", OkHttpSearchConsoleClient.errorMessage(400, "{\"error\":\"invalid\"}"));
    assertEquals("Request failed with HTTP 502", OkHttpSearchConsoleClient.errorMessage(502, "<html>"));
  }

  @Test
  void rejectedTokenWithFailedRefreshReportsTheRefreshFailure() {
    AccountRegistry registry = new AccountRegistry();
    Account account = registry.register("a", "a@example.com", "rt", "revoked", Long.MAX_VALUE);
    TokenRefresher refresher =
        refreshToken -> {
          throw new IdentityProviderException(400, "invalid_grant");
        };
    AuthenticatedClientCache cache =
        new AuthenticatedClientCache(refresher, new OkHttpClient(), Clock.systemUTC());
    OkHttpSearchConsoleClient authenticated =
        new OkHttpSearchConsoleClient(
            cache.getLiveClient(account).httpClient(),
            new SearchConsoleEndpoints(
                server.url("/webmasters/v3").toString(),
                server.url("/v1").toString(),
                server.url("/indexing/v3").toString()));
    server.enqueue(new MockResponse().setResponseCode(401));

    TokenRefreshException ex = assertThrows(TokenRefreshException.class, authenticated::listSites);
    assertEquals(GscMcpErrorCode.UNAUTHENTICATED, ex.getCode());
    assertEquals(1, server.getRequestCount());
  }
}
