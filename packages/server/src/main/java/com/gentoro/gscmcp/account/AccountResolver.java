package com.gentoro.gscmcp.account;

import com.gentoro.gscmcp.exception.AccountNotFoundException;
import com.gentoro.gscmcp.exception.NoAccountsConfiguredException;

/** Picks the account a tool call operates on. */
public class AccountResolver {
  private final AccountRegistry registry;

  public AccountResolver(AccountRegistry registry) {
    this.registry = registry;
  }

  /**
   * With a selector: exact id, then case-insensitive email. Without one: the account with the
   * lexicographically-first id.
   *
   * @throws AccountNotFoundException when the selector matches nothing
   * @throws NoAccountsConfiguredException when no selector is given and the registry is empty
   */
  public Account resolve(String selector) {
    if (selector != null && !selector.isBlank()) {
      return registry.lookup(selector).orElseThrow(() -> new AccountNotFoundException(selector));
    }
    return registry.first().orElseThrow(NoAccountsConfiguredException::new);
  }
}
