package com.gentoro.gscmcp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger access plus the {@code logging.level.*} overrides of the YAML configuration.
 *
 * <p>Output always goes to stderr (see {@code logback.xml}): in stdio mode stdout belongs to the
 * MCP protocol.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply {@code logging.level.<logger>: <LEVEL>} entries, {@code root} naming the root logger.
   * Does nothing when SLF4J is not bound to Logback.
   */
  public static void applyConfiguration(Configuration cfg) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("SLF4J is bound to {}, ignoring logging.level settings", factory.getClass().getName());
      return;
    }
    levelOverrides(cfg)
        .forEach(
            (name, level) -> {
              context.getLogger(name).setLevel(level);
              log.debug("Logger '{}' set to {}", name, level);
            });
  }

  /** Parsed overrides in declaration order; unknown level names are skipped with a warning. */
  static Map<String, Level> levelOverrides(Configuration cfg) {
    Map<String, Level> overrides = new LinkedHashMap<>();
    if (cfg == null) return overrides;
    Configuration levels = cfg.subset("logging.level");
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, null);
      if (value == null || value.isBlank()) continue;
      Level level = Level.toLevel(value.trim(), null);
      // dots inside a YAML key come back escaped as ".."
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key.replace("..", ".");
      if (level == null) {
        log.warn("Unknown log level '{}' for logger '{}'", value, name);
        continue;
      }
      overrides.put(name, level);
    }
    return overrides;
  }
}
