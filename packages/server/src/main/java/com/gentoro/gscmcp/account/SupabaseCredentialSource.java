package com.gentoro.gscmcp.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.gscmcp.auth.TokenListener;
import com.gentoro.gscmcp.exception.GscMcpErrorCode;
import com.gentoro.gscmcp.exception.GscMcpException;
import com.gentoro.gscmcp.exception.NetworkException;
import com.gentoro.gscmcp.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Reads connected Search Console accounts from a Supabase project through its PostgREST API.
 *
 * <p>Valid rows of {@code gsc_connections} provide id, email and the last access token; the
 * refresh token is read from {@code vault.decrypted_secrets}. Refreshed access tokens are written
 * back to {@code gsc_connections} for the accounts this source supplied.
 */
public class SupabaseCredentialSource implements CredentialSource, TokenListener {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(SupabaseCredentialSource.class);
  private static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final HttpUrl restUrl;
  private final String apiKey;
  private final Clock clock;
  private final Set<String> suppliedIds = ConcurrentHashMap.newKeySet();

  public SupabaseCredentialSource(
      OkHttpClient httpClient, String projectUrl, String apiKey, Clock clock) {
    this.httpClient = httpClient;
    this.restUrl = HttpUrl.get(projectUrl).newBuilder().addPathSegments("rest/v1").build();
    this.apiKey = apiKey;
    this.clock = clock;
  }

  @Override
  public String name() {
    return "Supabase(" + restUrl.host() + ")";
  }

  @Override
  public List<AccountEntry> load() {
    HttpUrl connectionsUrl =
        restUrl
            .newBuilder()
            .addPathSegment("gsc_connections")
            .addQueryParameter("select", "id,google_account_email,access_token,is_valid,vault_secret_id")
            .addQueryParameter("is_valid", "eq.true")
            .addQueryParameter("order", "google_account_email")
            .build();
    JsonNode connections = get(connectionsUrl, null);
    if (!connections.isArray()) {
      throw new GscMcpException(
          GscMcpErrorCode.SERIALIZATION_ERROR, "Supabase gsc_connections answer is not an array");
    }

    List<AccountEntry> entries = new ArrayList<>();
    for (JsonNode connection : connections) {
      String id = connection.path("id").asText(null);
      String email = connection.path("google_account_email").asText(null);
      String secretId = connection.path("vault_secret_id").asText(null);
      String refreshToken;
      try {
        refreshToken = secretId == null ? null : readSecret(secretId);
      } catch (GscMcpException e) {
        log.warn("Skipping connection '{}' ({}): {}", id, email, e.getMessage());
        continue;
      }
      entries.add(
          new AccountEntry(id, email, refreshToken, connection.path("access_token").asText(null)));
      if (id != null) suppliedIds.add(id);
    }
    log.info("Supabase returned {} valid connection(s)", entries.size());
    return entries;
  }

  @Override
  public void onTokensRefreshed(Account account) {
    if (!suppliedIds.contains(account.id())) return;
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("access_token", account.credentials().accessToken());
    body.put("last_token_refresh", Instant.now(clock).toString());
    HttpUrl url =
        restUrl
            .newBuilder()
            .addPathSegment("gsc_connections")
            .addQueryParameter("id", "eq." + account.id())
            .build();
    Request request =
        authorized(new Request.Builder().url(url))
            .header("Prefer", "return=minimal")
            .patch(RequestBody.create(body.toString(), JSON))
            .build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        log.error(
            "Failed to update access token of account '{}': HTTP {}", account.id(), response.code());
      }
    } catch (IOException e) {
      log.error("Failed to update access token of account '{}'", account.id(), e);
    }
  }

  private String readSecret(String secretId) {
    HttpUrl url =
        restUrl
            .newBuilder()
            .addPathSegment("decrypted_secrets")
            .addQueryParameter("select", "decrypted_secret")
            .addQueryParameter("id", "eq." + secretId)
            .build();
    JsonNode rows = get(url, "vault");
    if (!rows.isArray() || rows.isEmpty()) {
      return null;
    }
    return rows.get(0).path("decrypted_secret").asText(null);
  }

  private JsonNode get(HttpUrl url, String schema) {
    Request.Builder builder = authorized(new Request.Builder().url(url)).get();
    if (schema != null) {
      builder.header("Accept-Profile", schema);
    }
    try (Response response = httpClient.newCall(builder.build()).execute()) {
      ResponseBody body = response.body();
      String content = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new GscMcpException(
            GscMcpErrorCode.EXECUTION_ERROR,
            "Supabase query " + url.encodedPath() + " failed with HTTP " + response.code());
      }
      return JacksonUtility.readTree(content);
    } catch (IOException e) {
      throw new NetworkException("Could not reach Supabase at " + restUrl.host(), e);
    }
  }

  private Request.Builder authorized(Request.Builder builder) {
    return builder
        .header("apikey", apiKey)
        .header("Authorization", "Bearer " + apiKey)
        .header("Accept", "application/json");
  }
}
