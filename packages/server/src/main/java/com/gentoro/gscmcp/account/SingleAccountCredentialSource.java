package com.gentoro.gscmcp.account;

import java.util.List;

/**
 * One account given as a plain refresh token and email ({@code GSC_REFRESH_TOKEN}, {@code
 * GSC_EMAIL}), registered under id {@code default}.
 */
public class SingleAccountCredentialSource implements CredentialSource {
  public static final String DEFAULT_ID = "default";
  public static final String DEFAULT_EMAIL = "default";

  private final String refreshToken;
  private final String email;
  private final String accessToken;

  public SingleAccountCredentialSource(String refreshToken, String email, String accessToken) {
    this.refreshToken = refreshToken;
    this.email = email == null || email.isBlank() ? DEFAULT_EMAIL : email;
    this.accessToken = accessToken;
  }

  @Override
  public String name() {
    return "GSC_REFRESH_TOKEN";
  }

  @Override
  public List<AccountEntry> load() {
    return List.of(new AccountEntry(DEFAULT_ID, email, refreshToken, accessToken));
  }
}
