package com.gentoro.gscmcp.account;

import java.util.List;

/** Accounts document given inline, typically through {@code GSC_ACCOUNTS_JSON}. */
public class InlineJsonCredentialSource implements CredentialSource {
  private final String json;

  public InlineJsonCredentialSource(String json) {
    this.json = json;
  }

  @Override
  public String name() {
    return "GSC_ACCOUNTS_JSON";
  }

  @Override
  public List<AccountEntry> load() {
    return AccountsDocumentParser.parse(json, name());
  }
}
