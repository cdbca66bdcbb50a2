package com.gentoro.gscmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.searchconsole.SearchConsoleService;
import java.util.LinkedHashMap;
import java.util.Map;

public class InspectUrlTool extends GscTool {

  public InspectUrlTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("inspect_url")
        .description("Inspect a URL's index status, crawl info and rich results in Search Console")
        .property(accountProperty())
        .property(siteUrlProperty())
        .property(ToolProperty.string("inspectionUrl").description("The URL to inspect").required())
        .property(
            ToolProperty.string("languageCode")
                .description("Language code for messages")
                .defaultValue(SearchConsoleService.DEFAULT_LANGUAGE_CODE))
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String accountSelector = arguments.optionalString("account");
    String siteUrl = arguments.requiredString("siteUrl");
    String inspectionUrl = arguments.requiredString("inspectionUrl");
    String languageCode = arguments.optionalString("languageCode");
    arguments.ensureValid();

    Session session = open(accountSelector);
    JsonNode inspection = session.service().inspectUrl(siteUrl, inspectionUrl, languageCode);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("account", session.account().email());
    result.put("inspectedUrl", inspectionUrl);
    result.put("result", inspection);
    return result;
  }
}
