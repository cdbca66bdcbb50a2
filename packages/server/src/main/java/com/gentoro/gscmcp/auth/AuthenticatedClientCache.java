package com.gentoro.gscmcp.auth;

import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.account.AccountListener;
import com.gentoro.gscmcp.exception.ExceptionUtil;
import com.gentoro.gscmcp.exception.TokenRefreshException;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * One {@link AuthenticatedClient} per account id, created on first use and dropped whenever the
 * account is registered again.
 *
 * <p>{@link #getLiveClient(Account)} guarantees an access token valid for at least {@link
 * #EXPIRY_SKEW_MS} more milliseconds. At most one refresh runs per account: callers arriving while
 * one is in flight wait for it and reuse its outcome.
 */
public class AuthenticatedClientCache implements AccountListener {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(AuthenticatedClientCache.class);

  public static final long EXPIRY_SKEW_MS = 60_000L;

  private final ConcurrentHashMap<String, AuthenticatedClient> clients = new ConcurrentHashMap<>();
  private final List<TokenListener> tokenListeners = new CopyOnWriteArrayList<>();
  private final TokenRefresher refresher;
  private final OkHttpClient baseHttpClient;
  private final Clock clock;

  public AuthenticatedClientCache(
      TokenRefresher refresher, OkHttpClient baseHttpClient, Clock clock) {
    this.refresher = refresher;
    this.baseHttpClient = baseHttpClient;
    this.clock = clock;
  }

  public void addTokenListener(TokenListener listener) {
    tokenListeners.add(listener);
  }

  /**
   * Return the cached client for the account, refreshing its access token first when missing or
   * about to expire.
   *
   * @throws TokenRefreshException when a needed refresh fails; a stale token is never returned
   */
  public AuthenticatedClient getLiveClient(Account account) {
    AuthenticatedClient client =
        clients.compute(
            account.id(),
            (id, existing) ->
                existing != null && existing.account() == account
                    ? existing
                    : new AuthenticatedClient(account, baseHttpClient, this));
    if (needsRefresh(client)) {
      refresh(client, false);
    }
    return client;
  }

  public void invalidate(String accountId) {
    if (clients.remove(accountId) != null) {
      log.debug("Dropped cached client for account '{}'", accountId);
    }
  }

  public int size() {
    return clients.size();
  }

  @Override
  public void onRegistered(Account previous, Account current) {
    invalidate(current.id());
  }

  boolean needsRefresh(AuthenticatedClient client) {
    Long stored = client.account().credentials().expiresAt();
    long expiresAt = Math.max(client.expiresAt(), stored == null ? 0L : stored);
    return client.accessToken() == null || expiresAt < clock.millis() + EXPIRY_SKEW_MS;
  }

  /**
   * Refresh the client's access token unless another caller is already doing so, in which case
   * wait for that refresh instead.
   *
   * @param force refresh even when the current token still looks valid (the provider rejected it)
   */
  TokenResponse refresh(AuthenticatedClient client, boolean force) {
    CompletableFuture<TokenResponse> mine = new CompletableFuture<>();
    CompletableFuture<TokenResponse> inFlight =
        client.refreshInFlight().compareAndExchange(null, mine);
    if (inFlight != null) {
      log.debug("Refresh already in flight for account '{}', waiting", client.accountId());
      return await(client, inFlight);
    }

    try {
      if (!force && !needsRefresh(client)) {
        TokenResponse current = client.currentTokens();
        mine.complete(current);
        return current;
      }
      log.info("Refreshing access token for account '{}'", client.accountId());
      TokenResponse tokens = refresher.refresh(client.refreshToken());
      client.applyTokens(tokens);
      mine.complete(tokens);
      notifyListeners(client.account());
      return tokens;
    } catch (RuntimeException e) {
      TokenRefreshException failure = new TokenRefreshException(client.account().email(), e);
      log.warn("Token refresh failed for account '{}': {}", client.accountId(), e.getMessage());
      mine.completeExceptionally(failure);
      throw failure;
    } finally {
      client.refreshInFlight().compareAndSet(mine, null);
    }
  }

  /**
   * OkHttp authenticator hook: the API rejected the token, refresh once and replay the request.
   * Returns null when the replay was rejected too, which surfaces the 401 to the caller.
   *
   * @throws IOException wrapping the {@link TokenRefreshException} when the refresh fails, so the
   *     call fails with the refresh error rather than the 401
   */
  Request onUnauthorized(AuthenticatedClient client, Response response) throws IOException {
    if (response.priorResponse() != null) {
      return null;
    }
    String sent = response.request().header("Authorization");
    String current = client.accessToken();
    if (current != null && sent != null && !sent.equals("Bearer " + current)) {
      // refreshed by someone else since this request left
      return retryWith(response.request(), current);
    }
    log.info("Access token of account '{}' rejected with 401", client.accountId());
    try {
      TokenResponse tokens = refresh(client, true);
      return retryWith(response.request(), tokens.accessToken());
    } catch (TokenRefreshException e) {
      log.warn("Giving up on 401 for account '{}': {}", client.accountId(), e.getMessage());
      throw new IOException(
          "Token refresh after 401 failed for account '" + client.accountId() + "'", e);
    }
  }

  private static Request retryWith(Request request, String accessToken) {
    return request.newBuilder().header("Authorization", "Bearer " + accessToken).build();
  }

  private TokenResponse await(AuthenticatedClient client, CompletableFuture<TokenResponse> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      if (cause instanceof TokenRefreshException refreshFailure) {
        throw refreshFailure;
      }
      throw new TokenRefreshException(client.account().email(), cause);
    }
  }

  private void notifyListeners(Account account) {
    for (TokenListener listener : tokenListeners) {
      try {
        listener.onTokensRefreshed(account);
      } catch (RuntimeException e) {
        log.warn("Token listener failed for account '{}'", account.id(), e);
      }
    }
  }
}
