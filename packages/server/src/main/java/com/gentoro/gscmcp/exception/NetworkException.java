package com.gentoro.gscmcp.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends GscMcpException {
  public NetworkException(String message) {
    super(GscMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(GscMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
