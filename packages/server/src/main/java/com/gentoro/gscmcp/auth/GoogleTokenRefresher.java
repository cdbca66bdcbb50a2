package com.gentoro.gscmcp.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gscmcp.exception.IdentityProviderException;
import com.gentoro.gscmcp.exception.NetworkException;
import com.gentoro.gscmcp.exception.SerializationException;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Refresh-token grant against Google's OAuth 2.0 token endpoint. */
public class GoogleTokenRefresher implements TokenRefresher {
  // applied when the provider omits expires_in
  static final long DEFAULT_LIFETIME_SECONDS = 3600;

  private final OkHttpClient httpClient;
  private final OAuthClientConfig config;
  private final Clock clock;

  public GoogleTokenRefresher(OkHttpClient httpClient, OAuthClientConfig config, Clock clock) {
    this.httpClient = httpClient;
    this.config = config;
    this.clock = clock;
  }

  @Override
  public TokenResponse refresh(String refreshToken) {
    Request request =
        new Request.Builder()
            .url(config.tokenUri())
            .post(
                new FormBody.Builder()
                    .add("grant_type", "refresh_token")
                    .add("client_id", config.clientId())
                    .add("client_secret", config.clientSecret())
                    .add("refresh_token", refreshToken)
                    .build())
            .header("Accept", "application/json")
            .build();

    long requestedAt = clock.millis();
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String content = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new IdentityProviderException(response.code(), describeError(response.code(), content));
      }
      JsonNode json = JacksonUtility.readTree(content);
      String accessToken = text(json, "access_token");
      if (accessToken == null) {
        throw new IdentityProviderException(
            response.code(), "Token endpoint answered without an access_token");
      }
      long expiresIn =
          json.hasNonNull("expires_in") ? json.get("expires_in").asLong() : DEFAULT_LIFETIME_SECONDS;
      return new TokenResponse(
          accessToken, requestedAt + expiresIn * 1000L, text(json, "refresh_token"));
    } catch (IOException e) {
      throw new NetworkException("Could not reach token endpoint " + config.tokenUri(), e);
    }
  }

  private static String describeError(int status, String content) {
    try {
      JsonNode json = JacksonUtility.readTree(content);
      String error = text(json, "error");
      String description = text(json, "error_description");
      if (error != null) {
        return description == null ? error : error + ": " + description;
      }
    } catch (SerializationException ignored) {
      // not JSON, fall through to the status line
    }
    return "Token endpoint answered HTTP " + status;
  }

  private static String text(JsonNode json, String field) {
    if (json == null || !json.hasNonNull(field)) return null;
    String value = json.get(field).asText();
    return value.isBlank() ? null : value;
  }
}
