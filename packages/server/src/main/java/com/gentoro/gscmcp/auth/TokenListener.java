package com.gentoro.gscmcp.auth;

import com.gentoro.gscmcp.account.Account;

/** Told about every successful refresh, after the account record has been updated. */
@FunctionalInterface
public interface TokenListener {
  void onTokensRefreshed(Account account);
}
