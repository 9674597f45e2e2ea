package ca.gc.cra.geosession.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Grid index systems a session may be configured with.
 * <p><strong>Role:</strong> Configuration enum carried by {@link GeoSettings}; the indexing itself is done by
 * the extension, not by this project.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum IndexSystemId {
  /** Uber H3 hexagonal grid. */
  H3,
  /** British National Grid. */
  BNG;

  /**
   * Parses an index system name, defaulting to {@link #H3} when blank.
   *
   * @param value textual representation such as {@code "h3"} or {@code "BNG"}
   * @return parsed index system
   * @throws IllegalArgumentException if the string does not match a known index system
   */
  public static IndexSystemId fromString(String value) {
    if (value == null || value.isBlank()) {
      return H3;
    }
    try {
      return IndexSystemId.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown index system: " + value, ex);
    }
  }
}
