package com.gentoro.gscmcp.account;

import java.util.Locale;
import java.util.Objects;

/**
 * A logical Search Console identity and its OAuth credentials.
 *
 * <p>{@code id} and {@code email} never change for a given instance. Credentials are published as
 * one immutable {@link Credentials} snapshot so readers never see an access token paired with
 * another token's expiry. Only the registry creates accounts and only the token refresh path
 * updates their credentials.
 */
public final class Account {

  /** Immutable credential tuple. {@code expiresAt} is epoch millis, null when unknown. */
  public record Credentials(String refreshToken, String accessToken, Long expiresAt) {}

  private final String id;
  private final String email;
  private volatile Credentials credentials;

  Account(String id, String email, String refreshToken, String accessToken, Long expiresAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.email = Objects.requireNonNull(email, "email");
    this.credentials =
        new Credentials(Objects.requireNonNull(refreshToken, "refreshToken"), accessToken, expiresAt);
  }

  public String id() {
    return id;
  }

  public String email() {
    return email;
  }

  /** Lowercased email, the secondary lookup key. */
  public String emailKey() {
    return emailKey(email);
  }

  public Credentials credentials() {
    return credentials;
  }

  /**
   * Write-through target of a successful refresh. A rotated refresh token replaces the stored one;
   * null keeps the current refresh token.
   */
  public synchronized void applyRefreshedTokens(
      String accessToken, Long expiresAt, String rotatedRefreshToken) {
    Credentials current = this.credentials;
    String refreshToken =
        rotatedRefreshToken == null || rotatedRefreshToken.isBlank()
            ? current.refreshToken()
            : rotatedRefreshToken;
    this.credentials = new Credentials(refreshToken, accessToken, expiresAt);
  }

  static String emailKey(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "Account{id='" + id + "', email='" + email + "'}";
  }
}
