package ca.gc.cra.geosession.config;

import java.util.Locale;

/**
 * What the GDAL harness does before a test when the native library cannot be enabled.
 *
 * @since 0.1.0
 */
public enum GdalFailurePolicy {
  /** Propagate the failure so the test errors. */
  FAIL,
  /** Abort the test as an unmet assumption. */
  SKIP;

  /**
   * Parses a policy name, defaulting to {@link #FAIL} when blank.
   *
   * @param value {@code fail} or {@code skip}, case-insensitive
   * @return parsed policy
   * @throws IllegalArgumentException if the value is unknown
   */
  public static GdalFailurePolicy fromString(String value) {
    if (value == null || value.isBlank()) {
      return FAIL;
    }
    try {
      return GdalFailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown gdal.unavailable policy: " + value, ex);
    }
  }
}
