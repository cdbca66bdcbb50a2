package com.gentoro.gscmcp.searchconsole;

import com.gentoro.gscmcp.utility.ConfigValues;
import org.apache.commons.configuration2.Configuration;

/** Base URLs of the Google APIs used; overridable for tests and proxies. */
public record SearchConsoleEndpoints(String webmastersUrl, String searchConsoleUrl, String indexingUrl) {
  public static final String WEBMASTERS_URL = "https://www.googleapis.com/webmasters/v3";
  public static final String SEARCH_CONSOLE_URL = "https://searchconsole.googleapis.com/v1";
  public static final String INDEXING_URL = "https://indexing.googleapis.com/v3";

  public static SearchConsoleEndpoints defaults() {
    return new SearchConsoleEndpoints(WEBMASTERS_URL, SEARCH_CONSOLE_URL, INDEXING_URL);
  }

  public static SearchConsoleEndpoints fromConfiguration(Configuration cfg) {
    return new SearchConsoleEndpoints(
        ConfigValues.stringOrDefault(cfg, "gsc.api.webmasters-url", WEBMASTERS_URL),
        ConfigValues.stringOrDefault(cfg, "gsc.api.searchconsole-url", SEARCH_CONSOLE_URL),
        ConfigValues.stringOrDefault(cfg, "gsc.api.indexing-url", INDEXING_URL));
  }
}
