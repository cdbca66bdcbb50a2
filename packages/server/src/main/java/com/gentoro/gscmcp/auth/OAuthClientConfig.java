package com.gentoro.gscmcp.auth;

import com.gentoro.gscmcp.exception.ConfigException;
import com.gentoro.gscmcp.utility.ConfigValues;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/** OAuth client credentials used for every refresh-token grant. */
public final class OAuthClientConfig {
  public static final String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";

  private final String clientId;
  private final String clientSecret;
  private final String tokenUri;

  public OAuthClientConfig(String clientId, String clientSecret, String tokenUri) {
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
    this.tokenUri = tokenUri == null || tokenUri.isBlank() ? DEFAULT_TOKEN_URI : tokenUri;
  }

  /**
   * Reads {@code gsc.oauth.client-id}, {@code gsc.oauth.client-secret} and {@code
   * gsc.oauth.token-uri}.
   *
   * @throws ConfigException when client id or secret are missing
   */
  public static OAuthClientConfig fromConfiguration(Configuration cfg) {
    String clientId = ConfigValues.optionalString(cfg, "gsc.oauth.client-id");
    String clientSecret = ConfigValues.optionalString(cfg, "gsc.oauth.client-secret");
    if (clientId == null || clientSecret == null) {
      throw new ConfigException("GOOGLE_CLIENT_ID and GOOGLE_CLIENT_SECRET are required");
    }
    return new OAuthClientConfig(
        clientId,
        clientSecret,
        ConfigValues.stringOrDefault(cfg, "gsc.oauth.token-uri", DEFAULT_TOKEN_URI));
  }

  public String clientId() {
    return clientId;
  }

  public String clientSecret() {
    return clientSecret;
  }

  public String tokenUri() {
    return tokenUri;
  }
}
