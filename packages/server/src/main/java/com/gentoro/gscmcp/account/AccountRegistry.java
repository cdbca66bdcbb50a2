package com.gentoro.gscmcp.account;

import com.gentoro.gscmcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory credential store.
 *
 * <p>Two explicit indexes point at the same {@link Account} instance: one by id, one by lowercased
 * email. Both are updated under a single lock so a concurrent reader observes either the state
 * before or after a registration, never a mix. Accounts are never removed.
 */
public class AccountRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(AccountRegistry.class);

  private final Object lock = new Object();
  private final Map<String, Account> byId = new HashMap<>();
  private final Map<String, Account> byEmail = new HashMap<>();
  private final List<AccountListener> listeners = new CopyOnWriteArrayList<>();

  public void addListener(AccountListener listener) {
    listeners.add(listener);
  }

  public Account register(String id, String email, String refreshToken, String accessToken) {
    return register(id, email, refreshToken, accessToken, null);
  }

  /**
   * Insert or overwrite the account registered under {@code id}. Overwriting replaces the
   * credentials and invalidates whatever the listeners cached for the id.
   *
   * @throws ValidationException when a required field is blank, or when the email already belongs
   *     to an account with another id
   */
  public Account register(
      String id, String email, String refreshToken, String accessToken, Long expiresAt) {
    List<String> problems = new ArrayList<>();
    if (isBlank(id)) problems.add("id: must not be blank");
    if (isBlank(email)) problems.add("email: must not be blank");
    if (isBlank(refreshToken)) problems.add("refreshToken: must not be blank");
    if (!problems.isEmpty()) {
      throw new ValidationException("Invalid account: " + String.join(", ", problems));
    }

    Account account =
        new Account(
            id.trim(),
            email.trim(),
            refreshToken.trim(),
            isBlank(accessToken) ? null : accessToken.trim(),
            expiresAt);

    synchronized (lock) {
      Account emailOwner = byEmail.get(account.emailKey());
      if (emailOwner != null && !emailOwner.id().equals(account.id())) {
        throw new ValidationException(
            "email: '" + account.email() + "' is already registered as account '"
                + emailOwner.id() + "'");
      }
      Account previous = byId.put(account.id(), account);
      if (previous != null) {
        byEmail.remove(previous.emailKey());
      }
      byEmail.put(account.emailKey(), account);

      for (AccountListener listener : listeners) {
        listener.onRegistered(previous, account);
      }
      if (previous == null) {
        log.info("Registered account '{}' ({})", account.id(), account.email());
      } else {
        log.info("Replaced credentials of account '{}' ({})", account.id(), account.email());
      }
    }
    return account;
  }

  /** Exact id match first, then case-insensitive email match. */
  public Optional<Account> lookup(String idOrEmail) {
    if (isBlank(idOrEmail)) return Optional.empty();
    String key = idOrEmail.trim();
    synchronized (lock) {
      Account account = byId.get(key);
      if (account == null) {
        account = byEmail.get(Account.emailKey(key));
      }
      return Optional.ofNullable(account);
    }
  }

  /** Distinct accounts ordered by id. */
  public List<Account> list() {
    List<Account> accounts;
    synchronized (lock) {
      accounts = new ArrayList<>(byId.values());
    }
    accounts.sort(Comparator.comparing(Account::id));
    return accounts;
  }

  /** The account with the lexicographically smallest id. */
  public Optional<Account> first() {
    synchronized (lock) {
      return byId.values().stream().min(Comparator.comparing(Account::id));
    }
  }

  public int count() {
    synchronized (lock) {
      return byId.size();
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
