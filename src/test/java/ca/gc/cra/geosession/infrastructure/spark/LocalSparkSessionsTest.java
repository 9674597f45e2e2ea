package ca.gc.cra.geosession.infrastructure.spark;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.apache.spark.SparkConf;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LocalSparkSessionsTest {
  private Logger sparkLogger;
  private Level originalLevel;

  @BeforeEach
  void rememberSparkLevel() {
    sparkLogger = (Logger) LoggerFactory.getLogger(LocalSparkSessions.SPARK_LOGGER);
    originalLevel = sparkLogger.getLevel();
  }

  @AfterEach
  void cleanUp() {
    LocalSparkSessions.cleanupAnyExistingSession();
    sparkLogger.setLevel(originalLevel);
  }

  @Test
  void createReplacesExistingSessionAndMirrorsLogLevel() {
    SparkSession first = LocalSparkSessions.create(conf("first"), "FATAL");
    assertEquals(Level.ERROR, sparkLogger.getLevel());

    SparkSession second = LocalSparkSessions.create(conf("second"), "WARN");

    assertTrue(first.sparkContext().isStopped());
    assertFalse(second.sparkContext().isStopped());
    assertEquals("second", second.sparkContext().appName());
    assertEquals(Level.WARN, sparkLogger.getLevel());
    assertTrue(SparkSession.getActiveSession().isDefined());
  }

  @Test
  void unknownLevelIsRejectedBeforeSessionIsBuilt() {
    assertThrows(IllegalArgumentException.class, () -> LocalSparkSessions.create(conf("bad"), "LOUD"));
    assertFalse(SparkSession.getActiveSession().isDefined());
  }

  @Test
  void cleanupReportsWhetherASessionWasStopped() {
    LocalSparkSessions.cleanupAnyExistingSession();
    assertFalse(LocalSparkSessions.cleanupAnyExistingSession());

    SparkSession session = LocalSparkSessions.create(conf("cleanup"), "FATAL");

    assertTrue(LocalSparkSessions.cleanupAnyExistingSession());
    assertTrue(session.sparkContext().isStopped());
    assertFalse(SparkSession.getDefaultSession().isDefined());
  }

  @Test
  void stopClearsSessionReferences() {
    SparkSession session = LocalSparkSessions.create(conf("stop"), "FATAL");

    LocalSparkSessions.stop(session);
    LocalSparkSessions.stop(null);

    assertTrue(session.sparkContext().isStopped());
    assertFalse(SparkSession.getActiveSession().isDefined());
    assertFalse(SparkSession.getDefaultSession().isDefined());
  }

  private static SparkConf conf(String appName) {
    return new SparkConf(false)
        .setMaster("local[1]")
        .setAppName(appName)
        .set("spark.ui.enabled", "false")
        .set("spark.driver.host", "127.0.0.1")
        .set("spark.driver.bindAddress", "127.0.0.1");
  }
}
