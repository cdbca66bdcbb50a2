package com.gentoro.gscmcp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * {@code env:} lookup that falls back to a dotenv file when a variable is not set in the process
 * environment. The file is read once, on the first miss. Supported lines: {@code KEY=value}, {@code
 * export KEY=value}, quoted values and {@code #} comments.
 */
final class EnvFileLookup implements Lookup {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(EnvFileLookup.class);

  static final List<Path> DEFAULT_CANDIDATES =
      List.of(Path.of(".env.local"), Path.of("packages/server/.env.local"));

  private final Function<String, String> environment;
  private final List<Path> candidates;
  private volatile Map<String, String> fileValues;

  EnvFileLookup(Function<String, String> environment, List<Path> candidates) {
    this.environment = environment;
    this.candidates = candidates;
  }

  static EnvFileLookup fromWorkingDirectory() {
    return new EnvFileLookup(System::getenv, DEFAULT_CANDIDATES);
  }

  @Override
  public Object lookup(String key) {
    String value = environment.apply(key);
    if (value != null && !value.isEmpty()) {
      return value;
    }
    return fileValues().get(key);
  }

  private Map<String, String> fileValues() {
    Map<String, String> values = fileValues;
    if (values == null) {
      synchronized (this) {
        values = fileValues;
        if (values == null) {
          values = readFirstExisting();
          fileValues = values;
        }
      }
    }
    return values;
  }

  private Map<String, String> readFirstExisting() {
    for (Path candidate : candidates) {
      if (Files.isRegularFile(candidate)) {
        log.info("Resolving unset variables from {}", candidate.toAbsolutePath());
        try {
          return parse(Files.readAllLines(candidate, StandardCharsets.UTF_8));
        } catch (IOException e) {
          log.warn("Could not read {}, ignoring it", candidate.toAbsolutePath(), e);
          return Map.of();
        }
      }
    }
    log.debug("No dotenv file found among {}", candidates);
    return Map.of();
  }

  static Map<String, String> parse(List<String> lines) {
    Map<String, String> values = new HashMap<>();
    for (String raw : lines) {
      String line = raw.trim();
      if (line.isEmpty() || line.startsWith("#")) continue;
      if (line.startsWith("export ")) {
        line = line.substring("export ".length()).trim();
      }
      int eq = line.indexOf('=');
      if (eq <= 0) continue;
      String value = line.substring(eq + 1).trim();
      if (value.length() >= 2
          && (value.startsWith("\"") && value.endsWith("\"")
              || value.startsWith("'") && value.endsWith("'"))) {
        value = value.substring(1, value.length() - 1);
      }
      values.put(line.substring(0, eq).trim(), value);
    }
    return values;
  }
}
