package com.gentoro.gscmcp;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line options. Both {@code --name value} and {@code --name=value} are accepted; anything
 * not starting with {@code --} is ignored.
 *
 * <ul>
 *   <li><b>--config-file</b> YAML location, default {@code classpath:application.yaml}
 *   <li><b>--transport</b> {@code stdio} or {@code http}, overriding the {@code transport} key
 * </ul>
 */
public class StartupParameters {
  public static final String CONFIG_FILE = "config-file";
  public static final String TRANSPORT = "transport";
  public static final String DEFAULT_CONFIG_FILE = "classpath:application.yaml";
  static final Set<String> TRANSPORTS = Set.of("stdio", "http");

  private final Map<String, String> parameters;

  public StartupParameters(String[] arguments) {
    this.parameters = Collections.unmodifiableMap(parse(arguments == null ? new String[0] : arguments));
    validate();
  }

  private static Map<String, String> parse(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int i = 0; i < arguments.length; i++) {
      String argument = arguments[i];
      if (!argument.startsWith("--")) continue;
      int eq = argument.indexOf('=');
      if (eq > 2) {
        result.put(argument.substring(2, eq), argument.substring(eq + 1));
      } else if (i + 1 < arguments.length && !arguments[i + 1].startsWith("--")) {
        result.put(argument.substring(2), arguments[++i]);
      } else {
        throw new IllegalArgumentException("Missing value for " + argument);
      }
    }
    return result;
  }

  private void validate() {
    String transport = parameters.get(TRANSPORT);
    if (transport != null && !TRANSPORTS.contains(transport)) {
      throw new IllegalArgumentException(
          "Invalid transport: " + transport + " (expected stdio or http)");
    }
    String configFile = parameters.get(CONFIG_FILE);
    if (configFile != null && configFile.isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
  }

  /** Configuration location, e.g. "classpath:application.yaml" or "/etc/gsc-mcp.yaml". */
  public String configFile() {
    return parameters.getOrDefault(CONFIG_FILE, DEFAULT_CONFIG_FILE);
  }

  public Optional<String> transport() {
    return getOptionalParameter(TRANSPORT);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
