package com.gentoro.gscmcp.exception;

/** Resource requested was not found. */
public class NotFoundException extends GscMcpException {
  public NotFoundException(String message) {
    super(GscMcpErrorCode.NOT_FOUND, message);
  }
}
