package com.gentoro.jobwatch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and applying log levels declared in the application
 * configuration.
 *
 * <p>Levels are read from keys under {@code logging.level}, for example:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.jobwatch.transport: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.*} entries to the Logback context. Unknown level names fall back to
   * {@code DEBUG}, matching Logback's own parsing. Does nothing when SLF4J is bound to another
   * backend.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key);
      if (value == null || value.isBlank()) continue;
      // hierarchical configurations escape dots inside a key by doubling them
      String name = key.replace("..", ".");
      String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.DEBUG));
    }
  }
}
