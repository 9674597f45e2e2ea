package ca.gc.cra.geosession.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validation utilities for strings read from session configuration, harness YAML,
 * and CLI arguments.
 * <p><strong>Why:</strong> GDAL config options and Spark keys are passed straight into native code and the
 * session; malformed values must be rejected before they reach either.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked by {@code config} parsers and the doctor CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Parse strict boolean flags ({@code true}/{@code false}, case-insensitive).</li>
 *   <li>Normalize enumerated settings against a fixed vocabulary.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Parses a boolean flag, accepting only {@code true} or {@code false} in any case.
   *
   * @param name logical parameter name for diagnostics
   * @param value raw value; {@code null} or blank yields {@code defaultValue}
   * @param defaultValue value used when the flag is absent
   * @return parsed flag
   * @throws IllegalArgumentException if the value is neither {@code true} nor {@code false}
   */
  public static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(
          message(name, "must be true or false (was '" + value + "')"));
    };
  }

  /**
   * Normalizes {@code value} to upper case and checks it against the allowed vocabulary.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value; must be non-blank
   * @param allowed upper-case vocabulary
   * @return the upper-cased value
   * @throws IllegalArgumentException if the value is blank or not in {@code allowed}
   */
  public static String requireOneOf(String name, String value, Set<String> allowed) {
    String normalized = requireNonBlank(name, value).toUpperCase(Locale.ROOT);
    if (!allowed.contains(normalized)) {
      throw new IllegalArgumentException(
          message(name, "must be one of " + allowed + " (was '" + value + "')"));
    }
    return normalized;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
