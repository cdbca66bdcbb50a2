package com.gentoro.gscmcp.account;

import com.gentoro.gscmcp.exception.ValidationException;
import java.util.List;

/**
 * Populates an {@link AccountRegistry} from credential sources at startup.
 *
 * <p>Nothing here is fatal: a source that fails is treated as empty, incomplete entries are
 * skipped. With zero accounts the server still starts and default resolution fails later.
 */
public class AccountLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(AccountLoader.class);

  private final AccountRegistry registry;

  public AccountLoader(AccountRegistry registry) {
    this.registry = registry;
  }

  /** Returns the number of entries registered across all sources. */
  public int load(List<CredentialSource> sources) {
    int registered = 0;
    for (CredentialSource source : sources) {
      List<AccountEntry> entries;
      try {
        entries = source.load();
      } catch (RuntimeException e) {
        log.warn("Failed to load accounts from {}, treating it as empty: {}", source.name(),
            e.getMessage());
        continue;
      }
      for (AccountEntry entry : entries) {
        if (register(source, entry)) registered++;
      }
    }

    if (registry.count() == 0) {
      log.warn(
          "No accounts configured; calls will fail until an account is added with register_account");
    } else {
      log.info("Loaded {} account(s)", registry.count());
    }
    return registered;
  }

  private boolean register(CredentialSource source, AccountEntry entry) {
    try {
      registry.register(
          entry.getId(),
          entry.getEmail(),
          entry.getRefreshToken(),
          entry.getAccessToken(),
          entry.getExpiresAt());
      return true;
    } catch (ValidationException e) {
      log.warn("Skipping {} from {}: {}", entry, source.name(), e.getMessage());
      return false;
    }
  }
}
