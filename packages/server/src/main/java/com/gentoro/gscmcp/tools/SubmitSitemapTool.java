package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import java.util.LinkedHashMap;
import java.util.Map;

public class SubmitSitemapTool extends GscTool {

  public SubmitSitemapTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("submit_sitemap")
        .description("Submit a sitemap to Google Search Console")
        .property(accountProperty())
        .property(siteUrlProperty())
        .property(
            ToolProperty.string("feedpath")
                .description("The URL of the sitemap to submit")
                .required())
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String accountSelector = arguments.optionalString("account");
    String siteUrl = arguments.requiredString("siteUrl");
    String feedpath = arguments.requiredString("feedpath");
    arguments.ensureValid();

    Session session = open(accountSelector);
    session.service().submitSitemap(siteUrl, feedpath);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("success", true);
    result.put("account", session.account().email());
    result.put("siteUrl", siteUrl);
    result.put("sitemap", feedpath);
    result.put("message", "Sitemap submitted successfully");
    return result;
  }
}
