package ca.gc.cra.geosession.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default harness configuration.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and system property overrides.</p>
 */
public final class HarnessDefaults {
  public static final String SPARK_MASTER = "spark.master";
  public static final String SPARK_APP_NAME = "spark.appName";
  public static final String SPARK_LOG_LEVEL = "spark.logLevel";
  /** Prefix for extra Spark configuration entries; the remainder of the key is the Spark key. */
  public static final String SPARK_CONF_PREFIX = "spark.conf.";
  public static final String CHECKPOINT_PREFIX = "checkpoint.prefix";
  public static final String GDAL_RUNTIME = "gdal.runtime";
  public static final String GDAL_UNAVAILABLE = "gdal.unavailable";
  public static final String METRICS_EXPORTER = "metrics.exporter";

  private static final Map<String, String> DEFAULTS = buildDefaults();

  private HarnessDefaults() {}

  /**
   * Returns the default key/value pairs.
   *
   * @return unmodifiable map of defaults
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(SPARK_MASTER, "local[2]");
    map.put(SPARK_APP_NAME, "geosession-test");
    map.put(SPARK_LOG_LEVEL, "FATAL");
    map.put(CHECKPOINT_PREFIX, "mosaic");
    map.put(GDAL_RUNTIME, "jni");
    map.put(GDAL_UNAVAILABLE, "fail");
    map.put(METRICS_EXPORTER, "none");
    return Map.copyOf(map);
  }
}
