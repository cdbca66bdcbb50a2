package com.gentoro.gscmcp.auth;

import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.http.BearerTokenInterceptor;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.OkHttpClient;

/**
 * Live, authenticated handle for one account. Owned by {@link AuthenticatedClientCache}; callers
 * only use {@link #httpClient()} and the token accessors.
 *
 * <p>The OkHttp client stamps every request with the token current at send time and, on a 401,
 * asks the cache for an out-of-band refresh.
 */
public class AuthenticatedClient {
  private final Account account;
  private final OkHttpClient httpClient;
  private final AtomicReference<CompletableFuture<TokenResponse>> refreshInFlight =
      new AtomicReference<>();
  private volatile Account.Credentials credentials;

  AuthenticatedClient(Account account, OkHttpClient baseClient, AuthenticatedClientCache cache) {
    this.account = account;
    this.credentials = account.credentials();
    this.httpClient =
        baseClient
            .newBuilder()
            .addInterceptor(new BearerTokenInterceptor(this::accessToken))
            .authenticator((route, response) -> cache.onUnauthorized(this, response))
            .build();
  }

  public String accountId() {
    return account.id();
  }

  public Account account() {
    return account;
  }

  public OkHttpClient httpClient() {
    return httpClient;
  }

  public String accessToken() {
    return credentials.accessToken();
  }

  /** Last known expiry in epoch millis, 0 when unknown. */
  public long expiresAt() {
    Long expiresAt = credentials.expiresAt();
    return expiresAt == null ? 0L : expiresAt;
  }

  String refreshToken() {
    return credentials.refreshToken();
  }

  AtomicReference<CompletableFuture<TokenResponse>> refreshInFlight() {
    return refreshInFlight;
  }

  TokenResponse currentTokens() {
    Account.Credentials current = credentials;
    return new TokenResponse(current.accessToken(), expiresAt(), null);
  }

  /** Updates the handle and writes the same tokens through to the account record. */
  void applyTokens(TokenResponse tokens) {
    account.applyRefreshedTokens(tokens.accessToken(), tokens.expiresAt(), tokens.refreshToken());
    this.credentials = account.credentials();
  }
}
