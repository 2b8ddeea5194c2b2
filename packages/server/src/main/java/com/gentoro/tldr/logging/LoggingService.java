package com.gentoro.tldr.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and for applying level overrides from the application
 * configuration.
 *
 * <p>Levels are read from keys shaped like {@code logging.level.<logger-name>}; the special name
 * {@code root} addresses the root logger. Unknown level names fall back to {@code INFO}.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      // Some other SLF4J binding is active, leave its configuration alone.
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) {
        continue;
      }
      // Keys written as a single dotted YAML key come back with escaped ("..") separators.
      String loggerName =
          "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name.replace("..", ".");
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }
  }
}
