package com.gentoro.codex.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger access for the whole codebase, plus runtime levels from configuration:
 *
 * <pre>
 *   logging:
 *     level:
 *       root: INFO
 *       com.gentoro.codex.ingestion: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Applies {@code logging.level.*}. Unknown level names are skipped with a warning.
   *
   * @return number of loggers whose level was set
   */
  public static int applyConfiguration(Configuration cfg) {
    if (cfg == null) return 0;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to Logback; ignoring logging.level settings");
      return 0;
    }
    int applied = 0;
    for (Map.Entry<String, Level> e : levels(cfg).entrySet()) {
      String name = e.getKey().equalsIgnoreCase("root") ? Logger.ROOT_LOGGER_NAME : e.getKey();
      ctx.getLogger(name).setLevel(e.getValue());
      applied++;
    }
    return applied;
  }

  static Map<String, Level> levels(Configuration cfg) {
    Map<String, Level> result = new LinkedHashMap<>();
    Configuration section = cfg.subset("logging.level");
    Iterator<String> keys = section.getKeys();
    while (keys.hasNext()) {
      String logger = keys.next();
      String value = section.getString(logger, "");
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for logger '{}'", value, logger);
        continue;
      }
      result.put(logger, level);
    }
    return result;
  }
}
