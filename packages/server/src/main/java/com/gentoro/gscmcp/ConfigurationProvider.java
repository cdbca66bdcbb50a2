package com.gentoro.gscmcp;

import com.gentoro.gscmcp.exception.ConfigException;
import java.io.File;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the server's YAML configuration into an Apache Commons {@link Configuration}.
 *
 * <p>The location is {@code classpath:<resource>}, a {@code file:} URI or a filesystem path.
 * {@code ${env:NAME}} placeholders are resolved by {@link EnvFileLookup}: process environment
 * first, then {@code .env.local}. Unresolved placeholders stay in the value and are treated as
 * absent by {@code ConfigValues}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(ConfigurationProvider.class);
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this(location, EnvFileLookup.fromWorkingDirectory());
  }

  ConfigurationProvider(String location, EnvFileLookup envLookup) {
    String resolved =
        location == null || location.isBlank()
            ? CLASSPATH_PREFIX + "application.yaml"
            : location.trim();
    YAMLConfiguration yaml = load(resolved);
    yaml.getInterpolator().registerLookup("env", envLookup);
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration load(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
    }
    File file;
    try {
      URI uri = URI.create(location);
      file = "file".equalsIgnoreCase(uri.getScheme()) ? new File(uri) : new File(location);
    } catch (IllegalArgumentException e) {
      log.debug("'{}' is not a URI, reading it as a path", location);
      file = new File(location);
    }
    return fromFile(file);
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    InputStream input = loader.getResourceAsStream(resource);
    if (input == null) {
      log.warn("Configuration resource '{}' not on classpath, starting with an empty one", resource);
      return new YAMLConfiguration();
    }
    log.info("Loading configuration from classpath:{}", resource);
    try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
      YAMLConfiguration yaml = new YAMLConfiguration();
      yaml.read(reader);
      return yaml;
    } catch (Exception e) {
      throw new ConfigException("Could not parse classpath:" + resource, e);
    }
  }

  private static YAMLConfiguration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from {}", file.getAbsolutePath());
    try {
      return new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
          .configure(new Parameters().fileBased().setFile(file))
          .getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Could not parse " + file.getAbsolutePath(), e);
    }
  }
}
