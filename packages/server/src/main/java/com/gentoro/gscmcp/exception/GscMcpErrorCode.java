package com.gentoro.gscmcp.exception;

/**
 * Canonical error codes for gsc-mcp, loosely following Google RPC status codes. Codes are stable
 * and are reported back to MCP clients alongside the message.
 */
public enum GscMcpErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  PERMISSION_DENIED,
  UNAUTHENTICATED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  EXECUTION_ERROR,
  NETWORK_ERROR,
}
