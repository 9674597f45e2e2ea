package ca.gc.cra.geosession.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Logback levels at runtime for the CLI and the test harness.
 * <p><strong>Why:</strong> Spark sessions are quieted with Log4j-style level names (including {@code FATAL})
 * while Spark's own loggers write through SLF4J into Logback, so both must agree.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges level names to the logging backend.</p>
 * <p><strong>Thread-safety:</strong> Delegates to Logback, which synchronizes level changes internally.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when the backend is not Logback.</p>
 *
 * @implNote Logback has no {@code FATAL}; it maps to {@link Level#ERROR}.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Level names accepted by {@link #setLevel(String, String)}, matching Spark's {@code setLogLevel}. */
  public static final Set<String> LEVEL_NAMES =
      Set.of("ALL", "TRACE", "DEBUG", "INFO", "WARN", "ERROR", "FATAL", "OFF");

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of the named logger.
   *
   * @param loggerName logger name; {@link org.slf4j.Logger#ROOT_LOGGER_NAME} targets the root logger
   * @param levelName one of {@link #LEVEL_NAMES}, case-insensitive
   * @return {@code true} when the level was applied; {@code false} when the backend is not Logback
   * @throws IllegalArgumentException if {@code levelName} is not a known level
   */
  public static boolean setLevel(String loggerName, String levelName) {
    Objects.requireNonNull(loggerName, "loggerName");
    Level level = toLogbackLevel(levelName);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }

  /**
   * Maps a Log4j-style level name onto a Logback level.
   *
   * @param levelName level name, case-insensitive
   * @return matching Logback level
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Level toLogbackLevel(String levelName) {
    String normalized = levelName == null ? "" : levelName.trim().toUpperCase(Locale.ROOT);
    if (!LEVEL_NAMES.contains(normalized)) {
      throw new IllegalArgumentException("unknown log level: " + levelName);
    }
    if (normalized.equals("FATAL")) {
      return Level.ERROR;
    }
    return Level.toLevel(normalized);
  }
}
