package com.gentoro.gscmcp.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code {"accounts": [{id, email, refreshToken, accessToken?}]}}. A document that is not
 * valid JSON fails as a whole; individual entries of the wrong shape are logged and skipped.
 */
public final class AccountsDocumentParser {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(AccountsDocumentParser.class);

  private AccountsDocumentParser() {}

  public static List<AccountEntry> parse(String json, String sourceName) {
    JsonNode root = JacksonUtility.readTree(json);
    List<AccountEntry> entries = new ArrayList<>();
    JsonNode accounts = root == null ? null : root.get("accounts");
    if (accounts == null || accounts.isNull()) {
      log.warn("{} has no 'accounts' array, nothing to load", sourceName);
      return entries;
    }
    if (!accounts.isArray()) {
      log.warn("{}: 'accounts' is not an array, nothing to load", sourceName);
      return entries;
    }
    int index = 0;
    for (JsonNode node : accounts) {
      if (!node.isObject()) {
        log.warn("{}: skipping accounts[{}], not an object", sourceName, index);
      } else {
        try {
          entries.add(JacksonUtility.getJsonMapper().treeToValue(node, AccountEntry.class));
        } catch (Exception e) {
          log.warn("{}: skipping malformed accounts[{}]: {}", sourceName, index, e.getMessage());
        }
      }
      index++;
    }
    return entries;
  }
}
