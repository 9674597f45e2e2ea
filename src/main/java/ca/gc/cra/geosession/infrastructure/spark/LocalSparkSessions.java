package ca.gc.cra.geosession.infrastructure.spark;

import ca.gc.cra.geosession.logging.LoggingConfigurator;
import java.util.Objects;
import org.apache.spark.SparkConf;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scala.Option;

/**
 * <strong>What:</strong> Builds local Spark sessions for tests and tools.
 * <p><strong>Why:</strong> Spark keeps one active and one default session per JVM; a leftover session from an
 * earlier test class would silently absorb a new configuration through {@code getOrCreate}.</p>
 * <p><strong>Role:</strong> Infrastructure helper used by the JUnit harness.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; session lifecycle is driven from the test engine thread.</p>
 *
 * @since 0.1.0
 */
public final class LocalSparkSessions {
  private static final Logger log = LoggerFactory.getLogger(LocalSparkSessions.class);
  static final String SPARK_LOGGER = "org.apache.spark";

  private LocalSparkSessions() {}

  /**
   * Stops any active or default session and clears both references.
   *
   * @return {@code true} when a session was stopped
   */
  public static boolean cleanupAnyExistingSession() {
    Option<SparkSession> active = SparkSession.getActiveSession();
    Option<SparkSession> session = active.isDefined() ? active : SparkSession.getDefaultSession();
    if (session.isDefined()) {
      log.warn("An existing Spark session exists as the active or default session; stopping it before "
          + "creating a new one");
      session.get().stop();
      SparkSession.clearActiveSession();
      SparkSession.clearDefaultSession();
      return true;
    }
    return false;
  }

  /**
   * Creates a session from {@code conf} after cleaning up any existing one.
   *
   * @param conf complete Spark configuration including {@code spark.master}; must not be {@code null}
   * @param logLevel Log4j-style level applied to the Spark context and mirrored onto Logback
   * @return new session
   * @throws IllegalArgumentException if {@code logLevel} is unknown
   */
  public static SparkSession create(SparkConf conf, String logLevel) {
    Objects.requireNonNull(conf, "conf");
    LoggingConfigurator.toLogbackLevel(logLevel);
    cleanupAnyExistingSession();
    SparkSession session = SparkSession.builder().config(conf).getOrCreate();
    session.sparkContext().setLogLevel(logLevel);
    LoggingConfigurator.setLevel(SPARK_LOGGER, logLevel);
    log.debug("Spark session {} started on {}", session.sparkContext().appName(), session.sparkContext().master());
    return session;
  }

  /**
   * Stops {@code session} and clears it from Spark's active and default references.
   *
   * @param session session to stop; {@code null} is ignored
   */
  public static void stop(SparkSession session) {
    if (session == null) {
      return;
    }
    session.stop();
    SparkSession.clearActiveSession();
    SparkSession.clearDefaultSession();
  }
}
