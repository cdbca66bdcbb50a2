package com.gentoro.gscmcp.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends GscMcpException {
  public StateException(String message) {
    super(GscMcpErrorCode.FAILED_PRECONDITION, message);
  }
}
