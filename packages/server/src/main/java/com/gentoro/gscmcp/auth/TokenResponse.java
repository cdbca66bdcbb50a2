package com.gentoro.gscmcp.auth;

/**
 * Outcome of a refresh-token grant.
 *
 * @param accessToken the new access token
 * @param expiresAt absolute expiry in epoch millis
 * @param refreshToken rotated refresh token, null when the provider kept the old one
 */
public record TokenResponse(String accessToken, long expiresAt, String refreshToken) {}
