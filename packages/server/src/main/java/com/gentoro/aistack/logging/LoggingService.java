package com.gentoro.aistack.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.gentoro.aistack.exception.ConfigException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup and level control for the stack.
 *
 * <p>Levels are applied in two layers: {@link #STACK_DEFAULTS} quiets the HTTP client, the servlet
 * container and the Ollama client, then every {@code logging.level.<logger>} entry of
 * application.yaml overrides them. Capability calls tag their log lines with the MDC keys {@link
 * #MDC_API}, {@link #MDC_PROVIDER_ID} and {@link #MDC_OPERATION}; see {@link LogContext}.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  public static final String MDC_API = "api";
  public static final String MDC_PROVIDER_ID = "provider_id";
  public static final String MDC_OPERATION = "operation";

  static final String STACK_LOGGER = "com.gentoro.aistack";

  static final Map<String, Level> STACK_DEFAULTS = stackDefaults();

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  private static Map<String, Level> stackDefaults() {
    Map<String, Level> defaults = new LinkedHashMap<>();
    defaults.put(STACK_LOGGER, Level.INFO);
    defaults.put("okhttp3", Level.WARN);
    defaults.put("org.eclipse.jetty", Level.WARN);
    defaults.put("io.github.ollama4j", Level.WARN);
    return Map.copyOf(defaults);
  }

  /**
   * Apply the stack defaults and the {@code logging.level} overrides of {@code cfg}.
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.aistack.providers.memory: DEBUG
   * </pre>
   *
   * @return the level set on each logger, in the order it was applied
   * @throws ConfigException when a configured level is not a logback level name
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to logback ({}); log levels left as they are", factory);
      return Map.of();
    }
    Map<String, Level> applied = new LinkedHashMap<>(STACK_DEFAULTS);
    if (cfg != null) {
      Configuration levels = cfg.subset("logging.level");
      Iterator<String> it = levels.getKeys();
      while (it.hasNext()) {
        String key = it.next();
        String value = levels.getString(key, null);
        if (value == null || value.isBlank()) continue;
        // Dotted logger names come back with their dots escaped as "..".
        String name =
            "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key.replace("..", ".");
        applied.remove(name);
        applied.put(name, parseLevel(name, value));
      }
    }
    applied.forEach((name, level) -> ctx.getLogger(name).setLevel(level));
    log.debug("Applied log levels {}", applied);
    return applied;
  }

  static Level parseLevel(String loggerName, String value) {
    Level level = Level.toLevel(value.trim(), null);
    if (level == null) {
      throw new ConfigException(
          "Unknown log level '%s' for logger %s".formatted(value, loggerName));
    }
    return level;
  }
}
