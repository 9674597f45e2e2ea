package ca.gc.cra.geosession.config;

import ca.gc.cra.geosession.logging.LoggingConfigurator;
import ca.gc.cra.geosession.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges harness configuration from defaults, YAML, and system properties while enforcing precedence
 * and invariants.
 */
public final class ConfigMerger {
  /** System properties carrying harness overrides start with this prefix. */
  public static final String SYSTEM_PROPERTY_PREFIX = "geosession.";

  private static final Set<String> RESERVED_PROPERTIES = Set.of("geosession.config", "geosession.profile");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence system properties &gt; YAML &gt; defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param overrides override key/value pairs, already stripped of {@link #SYSTEM_PROPERTY_PREFIX}
   * @param defaults embedded defaults
   * @param warn consumer invoked when an override replaces a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    if (overrides != null) {
      for (Map.Entry<String, String> entry : overrides.entrySet()) {
        String key = entry.getKey();
        String value = entry.getValue();
        if (key == null || value == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("System property overrides YAML for key: " + key);
        }
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  /**
   * Extracts harness overrides from system properties.
   *
   * @param properties system properties snapshot
   * @return overrides keyed without the {@link #SYSTEM_PROPERTY_PREFIX}
   */
  public static Map<String, String> overridesFrom(Properties properties) {
    Map<String, String> overrides = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      if (name.startsWith(SYSTEM_PROPERTY_PREFIX) && !RESERVED_PROPERTIES.contains(name)) {
        overrides.put(name.substring(SYSTEM_PROPERTY_PREFIX.length()), properties.getProperty(name));
      }
    }
    return overrides;
  }

  private static void validate(Map<String, String> effective) {
    Strings.requireNonBlank(HarnessDefaults.SPARK_MASTER, effective.get(HarnessDefaults.SPARK_MASTER));
    Strings.requireNonBlank(HarnessDefaults.SPARK_APP_NAME, effective.get(HarnessDefaults.SPARK_APP_NAME));
    Strings.requireOneOf(
        HarnessDefaults.SPARK_LOG_LEVEL,
        effective.get(HarnessDefaults.SPARK_LOG_LEVEL),
        LoggingConfigurator.LEVEL_NAMES);
    Strings.requireNonBlank(HarnessDefaults.CHECKPOINT_PREFIX, effective.get(HarnessDefaults.CHECKPOINT_PREFIX));
    Strings.requireNonBlank(HarnessDefaults.GDAL_RUNTIME, effective.get(HarnessDefaults.GDAL_RUNTIME));
    Strings.requireOneOf(
        HarnessDefaults.GDAL_UNAVAILABLE, effective.get(HarnessDefaults.GDAL_UNAVAILABLE), Set.of("FAIL", "SKIP"));
    Strings.requireOneOf(
        HarnessDefaults.METRICS_EXPORTER, effective.get(HarnessDefaults.METRICS_EXPORTER), Set.of("OTLP", "NONE"));
  }
}
