package com.gentoro.gscmcp.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured view of a failure as reported to MCP clients.
 *
 * @param type simple class name of the exception
 * @param code stable error code, {@link GscMcpErrorCode#UNKNOWN} for foreign exceptions
 * @param message never null
 * @param context extra details, null when there are none
 */
public record ErrorDetails(
    String type, GscMcpErrorCode code, String message, Map<String, Object> context) {

  /** {@code {error, code, message, context?}} in that order. */
  public Map<String, Object> toBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", type);
    body.put("code", code.name());
    body.put("message", message);
    if (context != null) {
      body.put("context", context);
    }
    return body;
  }
}
