package com.gentoro.gscmcp.exception;

import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception of the server. Every failure a tool can report carries a {@link
 * GscMcpErrorCode}, which MCP clients receive next to the message, and optional context such as the
 * HTTP status returned by Google.
 */
public class GscMcpException extends RuntimeException {
  private final GscMcpErrorCode code;
  private final Map<String, Object> context;

  public GscMcpException(GscMcpErrorCode code, String message) {
    this(code, message, Map.of(), null);
  }

  public GscMcpException(GscMcpErrorCode code, String message, Throwable cause) {
    this(code, message, Map.of(), cause);
  }

  public GscMcpException(GscMcpErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public GscMcpException(
      GscMcpErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = context == null ? Map.of() : Map.copyOf(context);
  }

  public GscMcpErrorCode getCode() {
    return code;
  }

  /** Never null; empty when nothing beyond the message is known. */
  public Map<String, Object> getContext() {
    return context;
  }
}
