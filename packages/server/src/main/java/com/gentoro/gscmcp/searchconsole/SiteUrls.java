package com.gentoro.gscmcp.searchconsole;

import java.util.Locale;
import okhttp3.HttpUrl;

/** Conversion of URL-prefix site URLs to the Search Console domain-property form. */
public final class SiteUrls {
  public static final String DOMAIN_PROPERTY_PREFIX = "sc-domain:";

  private SiteUrls() {}

  /**
   * {@code https://www.example.com/} becomes {@code sc-domain:www.example.com}. Strings already in
   * domain-property form, other schemes and unparsable input come back unchanged.
   *
   * <p>Parsing is lenient: hosts with underscores and unencoded spaces in the path are accepted.
   */
  public static String toDomainProperty(String siteUrl) {
    if (siteUrl == null) return null;
    // HttpUrl only parses http and https
    HttpUrl url = HttpUrl.parse(siteUrl.trim());
    if (url == null) {
      return siteUrl;
    }
    return DOMAIN_PROPERTY_PREFIX + url.host().toLowerCase(Locale.ROOT);
  }
}
