package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.exception.ExceptionUtil;
import com.gentoro.gscmcp.exception.NotFoundException;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Name-indexed set of tools plus the dispatch that turns results and failures into JSON. */
public class ToolRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(ToolRegistry.class);

  private final Map<String, GscTool> tools = new LinkedHashMap<>();

  public ToolRegistry(Collection<? extends GscTool> tools) {
    for (GscTool tool : tools) {
      if (this.tools.putIfAbsent(tool.name(), tool) != null) {
        throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
      }
    }
  }

  /** Registry holding every tool this server exposes. */
  public static ToolRegistry standard(GscMcp context) {
    List<GscTool> tools = new ArrayList<>();
    tools.add(new RegisterAccountTool(context));
    tools.add(new ListAccountsTool(context));
    tools.add(new ListSitesTool(context));
    tools.add(new SearchAnalyticsTool(context));
    tools.add(new DetectQuickWinsTool(context));
    tools.add(new ComparePeriodsTool(context));
    tools.add(new InspectUrlTool(context));
    tools.add(new SubmitUrlForIndexingTool(context));
    tools.add(new ListSitemapsTool(context));
    tools.add(new SubmitSitemapTool(context));
    return new ToolRegistry(tools);
  }

  public List<GscTool> tools() {
    return Collections.unmodifiableList(new ArrayList<>(tools.values()));
  }

  public ToolResponse invoke(String name, Map<String, Object> arguments) {
    try {
      GscTool tool = tools.get(name);
      if (tool == null) {
        throw new NotFoundException("Unknown tool: " + name);
      }
      log.debug("Invoking tool '{}'", name);
      Object result = tool.call(new ToolArguments(arguments));
      return new ToolResponse(JacksonUtility.toJson(result), false);
    } catch (Exception e) {
      log.error("Failed to handle MCP tool request '{}'", name, e);
      return new ToolResponse(JacksonUtility.toJson(errorBody(e)), true);
    }
  }

  static Map<String, Object> errorBody(Throwable t) {
    return ExceptionUtil.toErrorDetails(t).toBody();
  }

}
