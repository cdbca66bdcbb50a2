package com.gentoro.gscmcp.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends GscMcpException {
  public ConfigException(String message) {
    super(GscMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GscMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
