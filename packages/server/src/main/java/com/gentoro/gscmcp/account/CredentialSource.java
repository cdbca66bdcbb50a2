package com.gentoro.gscmcp.account;

import java.util.List;

/**
 * Supplies account credentials at startup. Implementations may return incomplete entries; the
 * {@link AccountLoader} validates and skips them.
 */
public interface CredentialSource {

  /** Short name used in log messages. */
  String name();

  /**
   * Read all entries of this source.
   *
   * @throws com.gentoro.gscmcp.exception.GscMcpException when the source cannot be read or parsed
   */
  List<AccountEntry> load();
}
