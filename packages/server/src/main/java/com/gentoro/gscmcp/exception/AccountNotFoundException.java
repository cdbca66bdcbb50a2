package com.gentoro.gscmcp.exception;

import java.util.Map;

/** The account selector given by the caller matched no registered account. */
public class AccountNotFoundException extends GscMcpException {
  private final String selector;

  public AccountNotFoundException(String selector) {
    super(
        GscMcpErrorCode.INVALID_ARGUMENT,
        "Account not found: " + selector,
        Map.of("account", String.valueOf(selector)));
    this.selector = selector;
  }

  public String getSelector() {
    return selector;
  }
}
