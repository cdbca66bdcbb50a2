package com.gentoro.gscmcp.auth;

/** Exchanges a refresh token for a fresh access token at the identity provider. */
@FunctionalInterface
public interface TokenRefresher {

  /**
   * @throws com.gentoro.gscmcp.exception.IdentityProviderException when the provider rejects the
   *     grant
   * @throws com.gentoro.gscmcp.exception.NetworkException when the provider cannot be reached
   */
  TokenResponse refresh(String refreshToken);
}
