package com.gentoro.gscmcp.searchconsole;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.analytics.PeriodComparator;
import com.gentoro.gscmcp.analytics.PeriodComparison;
import com.gentoro.gscmcp.analytics.QuickWin;
import com.gentoro.gscmcp.analytics.QuickWinDetector;
import com.gentoro.gscmcp.analytics.QuickWinThresholds;
import com.gentoro.gscmcp.exception.ExceptionUtil;
import com.gentoro.gscmcp.exception.GscMcpErrorCode;
import com.gentoro.gscmcp.exception.GscMcpException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Search Console operations for one authenticated account.
 *
 * <p>Calls addressed by site property (analytics query, sitemap listing and submission) retry once
 * with the {@code sc-domain:} form of the site when the first attempt fails with a permission
 * error; a failure of the retry propagates unchanged. URL inspection and indexing work on page
 * URLs and are never retried.
 */
public class SearchConsoleService {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(SearchConsoleService.class);

  public static final int QUICK_WINS_ROW_LIMIT = 25_000;
  public static final String DEFAULT_LANGUAGE_CODE = "en-US";
  public static final String URL_UPDATED = "URL_UPDATED";
  public static final String URL_DELETED = "URL_DELETED";

  private final SearchConsoleClient client;
  private final Executor executor;

  public SearchConsoleService(SearchConsoleClient client, Executor executor) {
    this.client = client;
    this.executor = executor;
  }

  public JsonNode listSites() {
    return client.listSites();
  }

  public SearchAnalyticsResponse searchAnalytics(String siteUrl, SearchAnalyticsRequest request) {
    return withPermissionFallback(siteUrl, site -> client.query(site, request));
  }

  /** Fetches query/page rows for the range and ranks them as quick wins. */
  public List<QuickWin> detectQuickWins(
      String siteUrl, String startDate, String endDate, QuickWinThresholds thresholds) {
    SearchAnalyticsResponse response =
        searchAnalytics(
            siteUrl,
            SearchAnalyticsRequest.builder()
                .startDate(startDate)
                .endDate(endDate)
                .dimensions(List.of("query", "page"))
                .rowLimit(QUICK_WINS_ROW_LIMIT)
                .dataState("all")
                .build());
    return QuickWinDetector.detect(response.getRows(), thresholds);
  }

  /** Fetches both periods concurrently and joins them on the dimension keys. */
  public PeriodComparison comparePeriods(
      String siteUrl,
      String currentStart,
      String currentEnd,
      String previousStart,
      String previousEnd,
      List<String> dimensions,
      int rowLimit) {
    CompletableFuture<SearchAnalyticsResponse> current =
        CompletableFuture.supplyAsync(
            () -> searchAnalytics(siteUrl, periodRequest(currentStart, currentEnd, dimensions, rowLimit)),
            executor);
    CompletableFuture<SearchAnalyticsResponse> previous =
        CompletableFuture.supplyAsync(
            () ->
                searchAnalytics(
                    siteUrl, periodRequest(previousStart, previousEnd, dimensions, rowLimit)),
            executor);

    List<SearchAnalyticsRow> currentRows = join(current).getRows();
    List<SearchAnalyticsRow> previousRows = join(previous).getRows();
    return PeriodComparator.compare(
        currentStart, currentEnd, currentRows, previousStart, previousEnd, previousRows);
  }

  public JsonNode inspectUrl(String siteUrl, String inspectionUrl, String languageCode) {
    return client.inspectUrl(
        siteUrl, inspectionUrl, languageCode == null ? DEFAULT_LANGUAGE_CODE : languageCode);
  }

  public JsonNode submitUrlForIndexing(String url, String type) {
    return client.publishUrlNotification(url, type == null ? URL_UPDATED : type);
  }

  public JsonNode listSitemaps(String siteUrl) {
    return withPermissionFallback(siteUrl, client::listSitemaps);
  }

  public void submitSitemap(String siteUrl, String feedpath) {
    withPermissionFallback(
        siteUrl,
        site -> {
          client.submitSitemap(site, feedpath);
          return null;
        });
  }

  <T> T withPermissionFallback(String siteUrl, Function<String, T> call) {
    try {
      return call.apply(siteUrl);
    } catch (RuntimeException e) {
      if (!isPermissionError(e)) {
        throw e;
      }
      String domainProperty = SiteUrls.toDomainProperty(siteUrl);
      log.info("Permission error for '{}', retrying as '{}'", siteUrl, domainProperty);
      return call.apply(domainProperty);
    }
  }

  static boolean isPermissionError(Throwable t) {
    String message = t.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains("permission");
  }

  private static SearchAnalyticsRequest periodRequest(
      String start, String end, List<String> dimensions, int rowLimit) {
    return SearchAnalyticsRequest.builder()
        .startDate(start)
        .endDate(end)
        .dimensions(dimensions)
        .rowLimit(rowLimit)
        .dataState("all")
        .build();
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new GscMcpException(GscMcpErrorCode.EXECUTION_ERROR, "Period query failed", cause);
    }
  }
}
