package ca.gc.cra.geosession.config;

import java.util.Locale;

/**
 * Geometry backends a session may be configured with.
 *
 * @since 0.1.0
 */
public enum GeometryApi {
  /** LocationTech JTS Topology Suite. */
  JTS,
  /** Esri Geometry API for Java. */
  ESRI;

  /**
   * Parses a geometry backend name, defaulting to {@link #JTS} when blank.
   *
   * @param value textual representation such as {@code "jts"}
   * @return parsed geometry backend
   * @throws IllegalArgumentException if the string does not match a known backend
   */
  public static GeometryApi fromString(String value) {
    if (value == null || value.isBlank()) {
      return JTS;
    }
    try {
      return GeometryApi.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown geometry API: " + value, ex);
    }
  }
}
