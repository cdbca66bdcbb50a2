package com.gentoro.gscmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.GscMcp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ListSitesTool extends GscTool {

  public ListSitesTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("list_sites")
        .description("List all sites (properties) the account can access in Search Console")
        .property(accountProperty())
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String accountSelector = arguments.optionalString("account");
    arguments.ensureValid();

    Session session = open(accountSelector);
    JsonNode response = session.service().listSites();
    List<JsonNode> sites = new ArrayList<>();
    JsonNode entries = response == null ? null : response.get("siteEntry");
    if (entries != null && entries.isArray()) {
      entries.forEach(sites::add);
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("account", session.account().email());
    result.put("sites", sites);
    result.put("totalSites", sites.size());
    return result;
  }
}
