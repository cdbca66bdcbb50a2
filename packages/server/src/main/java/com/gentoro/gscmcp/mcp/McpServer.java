package com.gentoro.gscmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.tools.GscTool;
import com.gentoro.gscmcp.tools.ToolDefinition;
import com.gentoro.gscmcp.tools.ToolRegistry;
import com.gentoro.gscmcp.tools.ToolResponse;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * MCP server exposing every tool of the {@link ToolRegistry}, over stdio or over the Streamable
 * HTTP servlet transport mounted on the shared Jetty server.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) – servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) – reject HTTP DELETE; default: false
 *   <li><b>http.mcp.server.name</b> (string) – server name reported to clients; default:
 *       "gsc-mcp"
 *   <li><b>http.mcp.server.version</b> (string) – server version reported to clients; default:
 *       "1.0.0"
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(McpServer.class);

  private final GscMcp context;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(GscMcp context) {
    this.context = context;
  }

  /** Serve MCP over the process' stdin and stdout. */
  public void startStdio() {
    var transport = new StdioServerTransportProvider(jsonMapper());
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(transport)
            .serverInfo(serverName(), serverVersion())
            .capabilities(capabilities())
            .tools(toolSpecifications(context.toolRegistry()))
            .build();
    log.info("MCP server listening on stdio");
  }

  /** Register the MCP servlet on the shared Jetty context without managing its lifecycle. */
  public void registerServlet() {
    Configuration cfg = context.configuration();
    String endpoint = normalizeEndpoint(cfg.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = cfg.getBoolean("http.mcp.disallow-delete", false);

    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(jsonMapper())
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName(), serverVersion())
            .capabilities(capabilities())
            .tools(toolSpecifications(context.toolRegistry()))
            .build();

    context
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{}", context.httpServer().getPort(), endpoint);
  }

  static List<McpServerFeatures.SyncToolSpecification> toolSpecifications(ToolRegistry registry) {
    return registry.tools().stream().map(tool -> toolSpecification(registry, tool)).toList();
  }

  static McpServerFeatures.SyncToolSpecification toolSpecification(
      ToolRegistry registry, GscTool tool) {
    ToolDefinition definition = tool.definition();
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(definition.name())
                .description(definition.description())
                .inputSchema(inputSchema(definition))
                .build())
        .callHandler(
            (exchange, request) -> {
              ToolResponse response = registry.invoke(request.name(), request.arguments());
              return new McpSchema.CallToolResult(response.content(), response.error());
            })
        .build();
  }

  static McpSchema.JsonSchema inputSchema(ToolDefinition definition) {
    return new McpSchema.JsonSchema(
        "object",
        definition.schemaProperties(),
        definition.requiredProperties(),
        false,
        Collections.emptyMap(),
        Collections.emptyMap());
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    try {
      if (mcpServer != null) {
        mcpServer.closeGracefully();
      }
    } finally {
      mcpServer = null;
      if (servletTransport != null) {
        try {
          servletTransport.destroy();
        } finally {
          servletTransport = null;
        }
      }
    }
  }

  private String serverName() {
    return context.configuration().getString("http.mcp.server.name", "gsc-mcp");
  }

  private String serverVersion() {
    return context.configuration().getString("http.mcp.server.version", "1.0.0");
  }

  private static McpSchema.ServerCapabilities capabilities() {
    return McpSchema.ServerCapabilities.builder().tools(true).logging().build();
  }

  private static JacksonMcpJsonMapper jsonMapper() {
    return new JacksonMcpJsonMapper(new ObjectMapper());
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
