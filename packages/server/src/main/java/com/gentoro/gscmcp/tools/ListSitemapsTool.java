package com.gentoro.gscmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;

public class ListSitemapsTool extends GscTool {

  public ListSitemapsTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("list_sitemaps")
        .description("List all sitemaps for a site")
        .property(accountProperty())
        .property(siteUrlProperty())
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String accountSelector = arguments.optionalString("account");
    String siteUrl = arguments.requiredString("siteUrl");
    arguments.ensureValid();

    Session session = open(accountSelector);
    JsonNode response = session.service().listSitemaps(siteUrl);
    JsonNode sitemaps = response == null ? null : response.get("sitemap");

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("account", session.account().email());
    result.put("siteUrl", siteUrl);
    result.put(
        "sitemaps",
        sitemaps == null || sitemaps.isNull()
            ? JacksonUtility.getJsonMapper().createArrayNode()
            : sitemaps);
    return result;
  }
}
