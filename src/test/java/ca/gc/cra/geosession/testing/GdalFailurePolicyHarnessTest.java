package ca.gc.cra.geosession.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClass;

import ca.gc.cra.geosession.application.port.GdalUnavailableException;
import ca.gc.cra.geosession.config.GdalFailurePolicy;
import ca.gc.cra.geosession.config.GeoConfigKeys;
import ca.gc.cra.geosession.config.HarnessConfig;
import ca.gc.cra.geosession.infrastructure.spark.LocalSparkSessions;
import java.util.Map;
import org.apache.spark.SparkConf;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.testkit.engine.EngineTestKit;
import org.junit.platform.testkit.engine.Events;

/** Runs inner test classes through the Jupiter engine with GDAL unavailable or misconfigured. */
class GdalFailurePolicyHarnessTest {

  @Test
  void failPolicyFailsEachTestButStillBuildsTheSession() {
    Events tests = EngineTestKit.engine("junit-jupiter")
        .selectors(selectClass(FailPolicyCase.class))
        .execute()
        .testEvents();

    tests.assertStatistics(stats -> stats.started(1).failed(1).aborted(0));
    Throwable thrown = tests.failed().stream()
        .map(event -> event.getPayload(TestExecutionResult.class).orElseThrow())
        .map(result -> result.getThrowable().orElseThrow())
        .findFirst()
        .orElseThrow();
    assertTrue(thrown instanceof GdalUnavailableException, thrown.toString());
  }

  @Test
  void skipPolicyAbortsEachTest() {
    EngineTestKit.engine("junit-jupiter")
        .selectors(selectClass(SkipPolicyCase.class))
        .execute()
        .testEvents()
        .assertStatistics(stats -> stats.started(1).aborted(1).failed(0));
  }

  @Test
  void sessionIsCreatedEvenWhenGdalIsUnavailable() {
    EngineTestKit.engine("junit-jupiter")
        .selectors(selectClass(SessionOnlyCase.class))
        .execute()
        .testEvents()
        .assertStatistics(stats -> stats.succeeded(1));
  }

  @Test
  void skipPolicyAbortsWhenSessionSettingsAreInvalid() {
    EngineTestKit.engine("junit-jupiter")
        .selectors(selectClass(InvalidSettingsCase.class))
        .execute()
        .testEvents()
        .assertStatistics(stats -> stats.started(1).aborted(1).failed(0));
  }

  @Test
  void unknownRuntimeFailsTheClassWithoutLeavingASessionRunning() {
    LocalSparkSessions.cleanupAnyExistingSession();

    Events containers = EngineTestKit.engine("junit-jupiter")
        .selectors(selectClass(UnknownRuntimeCase.class))
        .execute()
        .containerEvents();

    containers.assertStatistics(stats -> stats.failed(1));
    Throwable thrown = containers.failed().stream()
        .map(event -> event.getPayload(TestExecutionResult.class).orElseThrow())
        .map(result -> result.getThrowable().orElseThrow())
        .findFirst()
        .orElseThrow();
    assertTrue(thrown instanceof IllegalArgumentException, thrown.toString());
    assertTrue(SparkSession.getActiveSession().isEmpty(), "active session left running");
    assertTrue(SparkSession.getDefaultSession().isEmpty(), "default session left running");
  }

  private static HarnessConfig disabledGdal(GdalFailurePolicy policy) {
    return gdal("disabled", policy);
  }

  private static HarnessConfig gdal(String runtime, GdalFailurePolicy policy) {
    return new HarnessConfig(
        "local[1]", "geosession-policy", "FATAL", Map.of(), "mosaic", runtime, policy, "none");
  }

  static class FailPolicyCase {
    @RegisterExtension
    static final SharedSparkSessionGdalExtension HARNESS = new SharedSparkSessionGdalExtension() {
      @Override
      protected HarnessConfig harnessConfig() {
        return disabledGdal(GdalFailurePolicy.FAIL);
      }
    };

    @Test
    void needsGdal() {
      fail("GDAL is disabled; the harness must stop this test first");
    }
  }

  static class SkipPolicyCase {
    @RegisterExtension
    static final SharedSparkSessionGdalExtension HARNESS = new SharedSparkSessionGdalExtension() {
      @Override
      protected HarnessConfig harnessConfig() {
        return disabledGdal(GdalFailurePolicy.SKIP);
      }
    };

    @Test
    void needsGdal() {
      fail("GDAL is disabled; the harness must abort this test first");
    }
  }

  static class SessionOnlyCase {
    @RegisterExtension
    static final SharedSparkSessionExtension HARNESS = new SharedSparkSessionGdalExtension() {
      @Override
      protected HarnessConfig harnessConfig() {
        return disabledGdal(GdalFailurePolicy.FAIL);
      }

      @Override
      protected void beforeEach(SharedSession shared) {
      }
    };

    @Test
    void sessionExistsWithoutGdal(SparkSession spark) {
      assertEquals("true", spark.conf().get("spark.databricks.labs.mosaic.gdal.native"));
      assertEquals("false", spark.conf().get("spark.mosaic.gdal.native.enabled", "false"));
    }
  }

  static class InvalidSettingsCase {
    @RegisterExtension
    static final SharedSparkSessionGdalExtension HARNESS = new SharedSparkSessionGdalExtension() {
      @Override
      protected HarnessConfig harnessConfig() {
        return gdal("recording", GdalFailurePolicy.SKIP);
      }

      @Override
      protected SparkConf sparkConf(HarnessConfig config) {
        return super.sparkConf(config).set(GeoConfigKeys.INDEX_SYSTEM, "S2");
      }
    };

    @Test
    void needsGdal() {
      fail("settings are invalid; the harness must abort this test first");
    }
  }

  static class UnknownRuntimeCase {
    @RegisterExtension
    static final SharedSparkSessionGdalExtension HARNESS = new SharedSparkSessionGdalExtension() {
      @Override
      protected HarnessConfig harnessConfig() {
        return gdal("no-such-runtime", GdalFailurePolicy.FAIL);
      }
    };

    @Test
    void neverRuns() {
      fail("the runtime cannot be resolved; the class must fail before this test");
    }
  }
}
