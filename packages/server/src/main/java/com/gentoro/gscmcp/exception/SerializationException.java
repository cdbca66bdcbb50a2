package com.gentoro.gscmcp.exception;

/** JSON or YAML (de)serialization failure. */
public class SerializationException extends GscMcpException {
  public SerializationException(String message, Throwable cause) {
    super(GscMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
