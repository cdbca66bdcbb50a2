package com.gentoro.gscmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.tools.GscTool;
import com.gentoro.gscmcp.tools.ToolArguments;
import com.gentoro.gscmcp.tools.ToolDefinition;
import com.gentoro.gscmcp.tools.ToolProperty;
import com.gentoro.gscmcp.tools.ToolRegistry;
import com.gentoro.gscmcp.utility.JacksonUtility;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class McpServerTest {

  /** Echoes the site URL back, or fails when asked to. */
  private static final class EchoTool extends GscTool {
    EchoTool() {
      super(null);
    }

    @Override
    public ToolDefinition definition() {
      return ToolDefinition.builder()
          .name("echo_site")
          .description("Echo a site URL")
          .property(ToolProperty.string("siteUrl").description("Site").required())
          .property(ToolProperty.integer("rowLimit").minimum(1).maximum(10).defaultValue(5))
          .build();
    }

    @Override
    public Object call(ToolArguments arguments) {
      String siteUrl = arguments.requiredString("siteUrl");
      arguments.ensureValid();
      return Map.of("siteUrl", siteUrl);
    }
  }

  private final ToolRegistry registry = new ToolRegistry(List.of(new EchoTool()));

  @Test
  void convertsDefinitionToInputSchema() {
    McpSchema.JsonSchema schema =
        McpServer.inputSchema(registry.tools().iterator().next().definition());

    assertEquals("object", schema.type());
    assertEquals(List.of("siteUrl"), schema.required());
    assertEquals(Boolean.FALSE, schema.additionalProperties());
    @SuppressWarnings("unchecked")
    Map<String, Object> rowLimit = (Map<String, Object>) schema.properties().get("rowLimit");
    assertEquals("integer", rowLimit.get("type"));
    assertEquals(5, rowLimit.get("default"));
  }

  @Test
  void callHandlerReturnsTextResult() {
    McpServerFeatures.SyncToolSpecification spec = McpServer.toolSpecifications(registry).get(0);
    assertEquals("echo_site", spec.tool().name());

    McpSchema.CallToolResult result =
        spec.callHandler()
            .apply(
                null,
                new McpSchema.CallToolRequest(
                    "echo_site", Map.of("siteUrl", "sc-domain:example.com")));

    assertEquals(Boolean.FALSE, result.isError());
    JsonNode body = JacksonUtility.readTree(((McpSchema.TextContent) result.content().get(0)).text());
    assertEquals("sc-domain:example.com", body.get("siteUrl").asText());
  }

  @Test
  void callHandlerFlagsFailures() {
    McpSchema.CallToolResult result =
        McpServer.toolSpecifications(registry)
            .get(0)
            .callHandler()
            .apply(null, new McpSchema.CallToolRequest("echo_site", Map.of()));

    assertEquals(Boolean.TRUE, result.isError());
    JsonNode body = JacksonUtility.readTree(((McpSchema.TextContent) result.content().get(0)).text());
    assertEquals("INVALID_ARGUMENT", body.get("code").asText());
  }
}
