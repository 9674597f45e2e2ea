package ca.gc.cra.geosession.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Port over a session's mutable runtime configuration.
 * <p><strong>Why:</strong> Lets the GDAL enabler read raster settings and record its enablement flag without
 * depending on a live Spark session.</p>
 * <p><strong>Role:</strong> Implemented by {@code SparkSessionConf} in production and by map-backed fakes in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations follow the thread-safety of the backing configuration.</p>
 *
 * @since 0.1.0
 */
public interface SessionConf {
  /**
   * Looks up a configuration value.
   *
   * @param key configuration key; must not be {@code null}
   * @return value when set; otherwise empty
   */
  Optional<String> get(String key);

  /**
   * Looks up a configuration value, falling back to {@code defaultValue}.
   *
   * @param key configuration key; must not be {@code null}
   * @param defaultValue value returned when the key is unset
   * @return configured value or {@code defaultValue}
   */
  default String get(String key, String defaultValue) {
    return get(key).orElse(defaultValue);
  }

  /**
   * Sets a configuration value for the lifetime of the session.
   *
   * @param key configuration key; must not be {@code null}
   * @param value value to store; must not be {@code null}
   */
  void set(String key, String value);
}
