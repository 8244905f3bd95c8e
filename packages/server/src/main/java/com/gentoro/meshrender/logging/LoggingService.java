package com.gentoro.meshrender.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be tuned from {@code application.yaml} using keys of the form {@code
 * logging.level.<logger-name>: <LEVEL>}; {@code logging.level.root} targets the root logger.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries to the running Logback context. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logback is not the active SLF4J binding, skipping level configuration");
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;

      // hierarchical keys escape dots inside a node name by doubling them
      String unescaped = name.replace("..", ".");
      String loggerName =
          "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class).warn("Ignoring unknown log level '{}' for {}", value, name);
        continue;
      }
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
