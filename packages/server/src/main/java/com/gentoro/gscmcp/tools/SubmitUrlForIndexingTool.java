package com.gentoro.gscmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.exception.ReportingApiException;
import com.gentoro.gscmcp.searchconsole.SearchConsoleService;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes a URL notification to the Indexing API. A 403 is reported as a {@code success:false}
 * result with setup guidance instead of an error, since it almost always means the API is not
 * enabled for the OAuth client.
 */
public class SubmitUrlForIndexingTool extends GscTool {
  static final List<String> TYPES =
      List.of(SearchConsoleService.URL_UPDATED, SearchConsoleService.URL_DELETED);

  private final Clock clock;

  public SubmitUrlForIndexingTool(GscMcp context) {
    this(context, Clock.systemUTC());
  }

  SubmitUrlForIndexingTool(GscMcp context, Clock clock) {
    super(context);
    this.clock = clock;
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("submit_url_for_indexing")
        .description("Request Google to crawl (or remove) a URL via the Indexing API")
        .property(accountProperty())
        .property(
            ToolProperty.string("url")
                .description("The full URL to submit for indexing")
                .required())
        .property(
            ToolProperty.string("type")
                .description("URL_UPDATED to request indexing, URL_DELETED to request removal")
                .enumValues(TYPES)
                .defaultValue(SearchConsoleService.URL_UPDATED))
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String accountSelector = arguments.optionalString("account");
    String url = arguments.requiredString("url");
    String type = arguments.optionalEnum("type", TYPES, SearchConsoleService.URL_UPDATED);
    arguments.ensureValid();

    Session session = open(accountSelector);
    JsonNode response;
    try {
      response = session.service().submitUrlForIndexing(url, type);
    } catch (ReportingApiException e) {
      if (e.getStatus() != 403) {
        throw e;
      }
      Map<String, Object> failure = new LinkedHashMap<>();
      failure.put("success", false);
      failure.put("error", "Indexing API not enabled or insufficient permissions");
      failure.put(
          "suggestion",
          "Enable the Indexing API in Google Cloud Console and ensure your OAuth has the indexing scope.");
      failure.put("url", url);
      return failure;
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("success", true);
    result.put("account", session.account().email());
    result.put("url", url);
    result.put("type", type);
    result.put("notifyTime", Instant.now(clock).toString());
    result.put(
        "message",
        SearchConsoleService.URL_UPDATED.equals(type)
            ? "Successfully submitted URL for indexing. Google will crawl this URL soon."
            : "Successfully requested URL removal from index.");
    result.put("response", response);
    return result;
  }
}
