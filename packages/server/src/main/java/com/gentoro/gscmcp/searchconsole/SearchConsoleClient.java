package com.gentoro.gscmcp.searchconsole;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Thin, authenticated access to the Search Console, URL Inspection and Indexing APIs. Failures
 * answered by the provider surface as {@link com.gentoro.gscmcp.exception.ReportingApiException}.
 */
public interface SearchConsoleClient {

  /** {@code GET sites}, the raw {@code siteEntry} list. */
  JsonNode listSites();

  SearchAnalyticsResponse query(String siteUrl, SearchAnalyticsRequest request);

  JsonNode inspectUrl(String siteUrl, String inspectionUrl, String languageCode);

  /** Indexing API {@code urlNotifications:publish}; {@code type} is URL_UPDATED or URL_DELETED. */
  JsonNode publishUrlNotification(String url, String type);

  JsonNode listSitemaps(String siteUrl);

  void submitSitemap(String siteUrl, String feedpath);
}
