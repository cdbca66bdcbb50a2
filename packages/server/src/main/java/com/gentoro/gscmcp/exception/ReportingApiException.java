package com.gentoro.gscmcp.exception;

import java.util.Locale;
import java.util.Map;

/**
 * Error answered by one of the Search Console APIs. Carries the HTTP status and the provider's own
 * error message, which is what the permission fallback inspects.
 */
public class ReportingApiException extends GscMcpException {
  private final int status;

  public ReportingApiException(int status, String message) {
    super(codeFor(status, message), message, Map.of("status", status));
    this.status = status;
  }

  public int getStatus() {
    return status;
  }

  /** Whether the provider complained about permissions on the requested property. */
  public boolean isPermissionError() {
    return getCode() == GscMcpErrorCode.PERMISSION_DENIED;
  }

  private static GscMcpErrorCode codeFor(int status, String message) {
    if (status == 403
        || (message != null && message.toLowerCase(Locale.ROOT).contains("permission"))) {
      return GscMcpErrorCode.PERMISSION_DENIED;
    }
    if (status == 401) {
      return GscMcpErrorCode.UNAUTHENTICATED;
    }
    if (status == 404) {
      return GscMcpErrorCode.NOT_FOUND;
    }
    return GscMcpErrorCode.EXECUTION_ERROR;
  }
}
