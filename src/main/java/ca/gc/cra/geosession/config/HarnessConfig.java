package ca.gc.cra.geosession.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable configuration for the shared Spark session test harness.
 * <p><strong>Why:</strong> Lets builds point the harness at another master, quiet or raise Spark logging, and
 * choose the GDAL runtime without editing test code.</p>
 * <p><strong>Role:</strong> Built once per JVM by {@link #load()} and handed to the JUnit extensions.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; the cached instance is published safely.</p>
 *
 * @param master Spark master URL
 * @param appName Spark application name
 * @param logLevel Log4j-style level applied to the session (for example {@code FATAL})
 * @param sparkConf extra Spark configuration entries
 * @param checkpointPrefix name prefix for the per-session checkpoint temp directory
 * @param gdalRuntime runtime name resolved by {@code GdalRuntimes}
 * @param gdalFailurePolicy behavior before each test when GDAL cannot be enabled
 * @param metricsExporter {@code otlp} or {@code none}
 * @since 0.1.0
 */
public record HarnessConfig(
    String master,
    String appName,
    String logLevel,
    Map<String, String> sparkConf,
    String checkpointPrefix,
    String gdalRuntime,
    GdalFailurePolicy gdalFailurePolicy,
    String metricsExporter) {
  private static final Logger log = LoggerFactory.getLogger(HarnessConfig.class);

  /** Classpath resource read when {@link #CONFIG_PROPERTY} is unset. */
  public static final String DEFAULT_RESOURCE = "geosession-test.yaml";
  /** System property naming a YAML file that replaces the classpath resource. */
  public static final String CONFIG_PROPERTY = "geosession.config";
  /** System property selecting the YAML profile section. */
  public static final String PROFILE_PROPERTY = "geosession.profile";
  public static final String DEFAULT_PROFILE = "test";

  private static volatile HarnessConfig cached;

  /**
   * Validates record components.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public HarnessConfig {
    Objects.requireNonNull(master, "master");
    Objects.requireNonNull(appName, "appName");
    Objects.requireNonNull(logLevel, "logLevel");
    sparkConf = Map.copyOf(Objects.requireNonNull(sparkConf, "sparkConf"));
    Objects.requireNonNull(checkpointPrefix, "checkpointPrefix");
    Objects.requireNonNull(gdalRuntime, "gdalRuntime");
    Objects.requireNonNull(gdalFailurePolicy, "gdalFailurePolicy");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
  }

  /**
   * Returns the harness configuration for this JVM, loading it on first use.
   *
   * @return cached configuration
   * @throws UncheckedIOException if the YAML document cannot be read
   * @throws IllegalArgumentException if the merged configuration is invalid
   */
  public static HarnessConfig load() {
    HarnessConfig current = cached;
    if (current == null) {
      synchronized (HarnessConfig.class) {
        current = cached;
        if (current == null) {
          current = load(System.getProperties(), HarnessConfig.class.getClassLoader());
          cached = current;
        }
      }
    }
    return current;
  }

  /**
   * Loads the configuration from the given system properties and class loader without caching.
   *
   * @param properties system properties snapshot
   * @param loader class loader used to find {@link #DEFAULT_RESOURCE}
   * @return merged configuration
   * @throws UncheckedIOException if the YAML document cannot be read
   * @throws IllegalArgumentException if the merged configuration is invalid
   */
  public static HarnessConfig load(Properties properties, ClassLoader loader) {
    String profile = properties.getProperty(PROFILE_PROPERTY, DEFAULT_PROFILE);
    String configPath = properties.getProperty(CONFIG_PROPERTY);
    Optional<Map<String, String>> yaml;
    try {
      yaml = (configPath == null || configPath.isBlank())
          ? YamlConfigLoader.loadResource(loader, DEFAULT_RESOURCE, profile)
          : YamlConfigLoader.load(Path.of(configPath.trim()), profile);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read harness configuration", ex);
    }
    if (yaml.isEmpty()) {
      log.debug("No harness YAML found; using defaults for profile {}", profile);
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        yaml, ConfigMerger.overridesFrom(properties), HarnessDefaults.asFlatMap(), log::warn);
    return fromMap(effective);
  }

  /**
   * Builds the configuration from an already merged flat map.
   *
   * @param map merged configuration
   * @return configuration record
   */
  public static HarnessConfig fromMap(Map<String, String> map) {
    Map<String, String> sparkConf = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : map.entrySet()) {
      if (entry.getKey().startsWith(HarnessDefaults.SPARK_CONF_PREFIX)) {
        sparkConf.put(entry.getKey().substring(HarnessDefaults.SPARK_CONF_PREFIX.length()), entry.getValue());
      }
    }
    return new HarnessConfig(
        map.get(HarnessDefaults.SPARK_MASTER).trim(),
        map.get(HarnessDefaults.SPARK_APP_NAME).trim(),
        map.get(HarnessDefaults.SPARK_LOG_LEVEL).trim().toUpperCase(Locale.ROOT),
        sparkConf,
        map.get(HarnessDefaults.CHECKPOINT_PREFIX).trim(),
        map.get(HarnessDefaults.GDAL_RUNTIME).trim().toLowerCase(Locale.ROOT),
        GdalFailurePolicy.fromString(map.get(HarnessDefaults.GDAL_UNAVAILABLE)),
        map.get(HarnessDefaults.METRICS_EXPORTER).trim().toLowerCase(Locale.ROOT));
  }
}
