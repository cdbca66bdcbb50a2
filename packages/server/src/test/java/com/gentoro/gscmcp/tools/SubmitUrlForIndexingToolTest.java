package com.gentoro.gscmcp.tools;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.account.AccountRegistry;
import com.gentoro.gscmcp.account.AccountResolver;
import com.gentoro.gscmcp.exception.ReportingApiException;
import com.gentoro.gscmcp.searchconsole.SearchConsoleService;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubmitUrlForIndexingToolTest {
  private static final String URL = "https://www.example.com/new-page";

  @Mock private GscMcp context;
  @Mock private SearchConsoleService service;

  private SubmitUrlForIndexingTool tool;

  @BeforeEach
  void setUp() {
    AccountRegistry registry = new AccountRegistry();
    registry.register("work", "me@work.com", "rt", null);
    lenient().when(context.accountResolver()).thenReturn(new AccountResolver(registry));
    lenient().when(context.searchConsoleFor(any(Account.class))).thenReturn(service);
    tool =
        new SubmitUrlForIndexingTool(
            context, Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  @SuppressWarnings("unchecked")
  void defaultsToUrlUpdated() {
    JsonNode apiAnswer = JacksonUtility.readTree("{\"urlNotificationMetadata\":{\"url\":\"" + URL + "\"}}");
    when(service.submitUrlForIndexing(URL, "URL_UPDATED")).thenReturn(apiAnswer);

    Map<String, Object> result = (Map<String, Object>) tool.call(new ToolArguments(Map.of("url", URL)));

    assertEquals(Boolean.TRUE, result.get("success"));
    assertEquals("me@work.com", result.get("account"));
    assertEquals("URL_UPDATED", result.get("type"));
    assertEquals("2024-03-01T10:00:00Z", result.get("notifyTime"));
    assertEquals(
        "Successfully submitted URL for indexing. Google will crawl this URL soon.",
        result.get("message"));
    assertSame(apiAnswer, result.get("response"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void removalHasItsOwnMessage() {
    when(service.submitUrlForIndexing(URL, "URL_DELETED"))
        .thenReturn(JacksonUtility.readTree("{}"));

    Map<String, Object> result =
        (Map<String, Object>)
            tool.call(new ToolArguments(Map.of("url", URL, "type", "URL_DELETED")));

    assertEquals("Successfully requested URL removal from index.", result.get("message"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void forbiddenBecomesGuidanceInsteadOfError() {
    when(service.submitUrlForIndexing(URL, "URL_UPDATED"))
        .thenThrow(new ReportingApiException(403, "Permission denied"));

    Map<String, Object> result = (Map<String, Object>) tool.call(new ToolArguments(Map.of("url", URL)));

    assertEquals(Boolean.FALSE, result.get("success"));
    assertEquals("Indexing API not enabled or insufficient permissions", result.get("error"));
    assertTrue(((String) result.get("suggestion")).contains("Indexing API"));
    assertEquals(URL, result.get("url"));
  }

  @Test
  void otherFailuresPropagate() {
    when(service.submitUrlForIndexing(URL, "URL_UPDATED"))
        .thenThrow(new ReportingApiException(500, "Backend error"));

    ReportingApiException ex =
        assertThrows(
            ReportingApiException.class, () -> tool.call(new ToolArguments(Map.of("url", URL))));
    assertEquals(500, ex.getStatus());
  }
}
