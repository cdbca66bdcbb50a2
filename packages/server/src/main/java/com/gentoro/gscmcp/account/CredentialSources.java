package com.gentoro.gscmcp.account;

import com.gentoro.gscmcp.utility.ConfigValues;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Builds the credential sources enabled in configuration, in load order. */
public final class CredentialSources {
  private CredentialSources() {}

  /**
   * Order: inline JSON ({@code gsc.accounts.json}), accounts file ({@code gsc.accounts.file}),
   * single refresh token ({@code gsc.accounts.refresh-token}), Supabase ({@code gsc.supabase.url}
   * plus {@code gsc.supabase.key}). Later sources overwrite earlier ones for the same id.
   */
  public static List<CredentialSource> fromConfiguration(
      Configuration cfg, OkHttpClient httpClient, Clock clock) {
    List<CredentialSource> sources = new ArrayList<>();

    String json = ConfigValues.optionalString(cfg, "gsc.accounts.json");
    if (json != null) {
      sources.add(new InlineJsonCredentialSource(json));
    }

    String file = ConfigValues.optionalString(cfg, "gsc.accounts.file");
    if (file != null) {
      sources.add(new FileCredentialSource(Path.of(file)));
    }

    String refreshToken = ConfigValues.optionalString(cfg, "gsc.accounts.refresh-token");
    if (refreshToken != null) {
      sources.add(
          new SingleAccountCredentialSource(
              refreshToken,
              ConfigValues.optionalString(cfg, "gsc.accounts.email"),
              ConfigValues.optionalString(cfg, "gsc.accounts.access-token")));
    }

    String supabaseUrl = ConfigValues.optionalString(cfg, "gsc.supabase.url");
    String supabaseKey = ConfigValues.optionalString(cfg, "gsc.supabase.key");
    if (supabaseUrl != null && supabaseKey != null) {
      sources.add(new SupabaseCredentialSource(httpClient, supabaseUrl, supabaseKey, clock));
    }
    return sources;
  }
}
