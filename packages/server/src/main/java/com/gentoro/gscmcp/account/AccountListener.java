package com.gentoro.gscmcp.account;

/** Notified after an account has been registered or its registration replaced. */
@FunctionalInterface
public interface AccountListener {

  /**
   * @param previous the record that was registered under the same id before, or null
   * @param current the record now registered
   */
  void onRegistered(Account previous, Account current);
}
