package com.gentoro.gscmcp.exception;

import java.util.Map;

/** Non-successful answer from the OAuth token endpoint (revoked token, invalid grant, ...). */
public class IdentityProviderException extends GscMcpException {
  private final int status;

  public IdentityProviderException(int status, String message) {
    super(GscMcpErrorCode.UNAUTHENTICATED, message, Map.of("status", status));
    this.status = status;
  }

  public int getStatus() {
    return status;
  }
}
