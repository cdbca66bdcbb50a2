package com.gentoro.gscmcp.exception;

import java.util.Map;

/**
 * The identity provider rejected the refresh token or could not be reached. Never retried by the
 * credential layer; the caller may retry the whole tool call.
 */
public class TokenRefreshException extends GscMcpException {
  private final String accountEmail;

  public TokenRefreshException(String accountEmail, Throwable cause) {
    super(
        GscMcpErrorCode.UNAUTHENTICATED,
        "Failed to refresh token for " + accountEmail + ": " + describe(cause),
        Map.of("account", String.valueOf(accountEmail)),
        cause);
    this.accountEmail = accountEmail;
  }

  public String getAccountEmail() {
    return accountEmail;
  }

  private static String describe(Throwable cause) {
    if (cause == null) return "unknown error";
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }
}
