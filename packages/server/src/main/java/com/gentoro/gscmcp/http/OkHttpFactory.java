package com.gentoro.gscmcp.http;

import java.time.Duration;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Builds the shared base client. Per-account clients derive from it with {@code newBuilder()} so
 * they share its connection pool and dispatcher.
 *
 * <p>Configuration keys, all in seconds:
 *
 * <ul>
 *   <li><b>gsc.http.connect-timeout</b> default 10
 *   <li><b>gsc.http.read-timeout</b> default 30; URL inspection can be slow
 *   <li><b>gsc.http.call-timeout</b> default 60, whole call including redirects
 * </ul>
 */
public final class OkHttpFactory {
  private OkHttpFactory() {}

  public static OkHttpClient create(Configuration cfg) {
    return new OkHttpClient.Builder()
        .connectTimeout(seconds(cfg, "gsc.http.connect-timeout", 10))
        .readTimeout(seconds(cfg, "gsc.http.read-timeout", 30))
        .callTimeout(seconds(cfg, "gsc.http.call-timeout", 60))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  private static Duration seconds(Configuration cfg, String key, long defaultValue) {
    return Duration.ofSeconds(cfg == null ? defaultValue : cfg.getLong(key, defaultValue));
  }
}
