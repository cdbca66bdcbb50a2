package com.gentoro.gscmcp.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends GscMcpException {
  public ValidationException(String message) {
    super(GscMcpErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GscMcpErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
