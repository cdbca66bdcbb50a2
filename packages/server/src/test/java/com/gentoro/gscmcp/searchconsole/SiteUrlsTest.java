package com.gentoro.gscmcp.searchconsole;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SiteUrlsTest {

  @Test
  void urlPrefixPropertyBecomesDomainProperty() {
    assertEquals("sc-domain:www.example.com", SiteUrls.toDomainProperty("https://www.example.com/"));
    assertEquals("sc-domain:example.com", SiteUrls.toDomainProperty("http://Example.com/blog/"));
  }

  @Test
  void lenientUrlsStillYieldTheirHost() {
    assertEquals(
        "sc-domain:my_shop.example.com", SiteUrls.toDomainProperty("https://my_shop.example.com/"));
    assertEquals(
        "sc-domain:www.example.com",
        SiteUrls.toDomainProperty("https://www.example.com/blog posts/"));
  }

  @Test
  void domainPropertyAndOtherInputStayUnchanged() {
    assertEquals("sc-domain:example.com", SiteUrls.toDomainProperty("sc-domain:example.com"));
    assertEquals("not a url", SiteUrls.toDomainProperty("not a url"));
    assertEquals("ftp://files.example.com/", SiteUrls.toDomainProperty("ftp://files.example.com/"));
    assertNull(SiteUrls.toDomainProperty(null));
  }
}
