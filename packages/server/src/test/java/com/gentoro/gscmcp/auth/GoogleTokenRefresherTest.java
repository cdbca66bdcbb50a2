package com.gentoro.gscmcp.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gscmcp.exception.IdentityProviderException;
import com.gentoro.gscmcp.exception.NetworkException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GoogleTokenRefresherTest {
  private static final long NOW = 1_700_000_000_000L;

  private MockWebServer server;
  private GoogleTokenRefresher refresher;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    OAuthClientConfig config =
        new OAuthClientConfig("client-id", "client-secret", server.url("/token").toString());
    refresher =
        new GoogleTokenRefresher(
            new OkHttpClient(), config, Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void postsRefreshTokenGrantAndComputesExpiry() throws Exception {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"access_token\":\"ya29.new\",\"expires_in\":1800,\"token_type\":\"Bearer\"}"));

    TokenResponse tokens = refresher.refresh("1//refresh");

    assertEquals("ya29.new", tokens.accessToken());
    assertEquals(NOW + 1_800_000, tokens.expiresAt());
    assertNull(tokens.refreshToken());

    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/token", request.getPath());
    String form = request.getBody().readUtf8();
    assertTrue(form.contains("grant_type=refresh_token"));
    assertTrue(form.contains("client_id=client-id"));
    assertTrue(form.contains("client_secret=client-secret"));
    assertTrue(form.contains("refresh_token=1%2F%2Frefresh"));
  }

  @Test
  void missingExpiresInDefaultsToOneHour() {
    server.enqueue(new MockResponse().setBody("{\"access_token\":\"at\",\"refresh_token\":\"rt-2\"}"));

    TokenResponse tokens = refresher.refresh("rt");

    assertEquals(NOW + GoogleTokenRefresher.DEFAULT_LIFETIME_SECONDS * 1000, tokens.expiresAt());
    assertEquals("rt-2", tokens.refreshToken());
  }

  @Test
  void providerRejectionCarriesErrorAndDescription() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(400)
            .setBody("{\"error\":\"invalid_grant\",\"error_description\":\"Token has been expired or revoked.\"}"));

    IdentityProviderException ex =
        assertThrows(IdentityProviderException.class, () -> refresher.refresh("rt"));
    assertEquals("invalid_grant: Token has been expired or revoked.", ex.getMessage());
  }

  @Test
  void nonJsonErrorFallsBackToStatus() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("upstream down"));

    IdentityProviderException ex =
        assertThrows(IdentityProviderException.class, () -> refresher.refresh("rt"));
    assertTrue(ex.getMessage().contains("503"));
  }

  @Test
  void unreachableEndpointIsANetworkError() throws Exception {
    MockWebServer stopped = new MockWebServer();
    stopped.start();
    String url = stopped.url("/token").toString();
    stopped.shutdown();
    GoogleTokenRefresher offline =
        new GoogleTokenRefresher(
            new OkHttpClient(),
            new OAuthClientConfig("id", "secret", url),
            Clock.systemUTC());

    assertThrows(NetworkException.class, () -> offline.refresh("rt"));
  }
}
