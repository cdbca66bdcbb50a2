package com.gentoro.gscmcp.exception;

/** No account is registered, so no default account can be selected. */
public class NoAccountsConfiguredException extends GscMcpException {
  public NoAccountsConfiguredException() {
    super(
        GscMcpErrorCode.FAILED_PRECONDITION,
        "No accounts configured. Use register_account or set GSC_ACCOUNTS_JSON/GSC_ACCOUNTS_FILE");
  }
}
