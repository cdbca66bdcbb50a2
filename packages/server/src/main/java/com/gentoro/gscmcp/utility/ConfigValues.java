package com.gentoro.gscmcp.utility;

import org.apache.commons.configuration2.Configuration;

/** Reads optional string settings, treating unresolved {@code ${env:...}} placeholders as absent. */
public final class ConfigValues {
  private ConfigValues() {}

  public static String optionalString(Configuration cfg, String key) {
    if (cfg == null) return null;
    String value = cfg.getString(key, null);
    if (value == null) return null;
    String trimmed = value.trim();
    if (trimmed.isEmpty() || trimmed.startsWith("${env:")) {
      return null;
    }
    return trimmed;
  }

  public static String stringOrDefault(Configuration cfg, String key, String defaultValue) {
    String value = optionalString(cfg, key);
    return value == null ? defaultValue : value;
  }
}
