package ca.gc.cra.geosession.api;

/**
 * <strong>What:</strong> Exit codes returned by the GeoSession command-line tools.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points and passed to {@link System#exit(int)}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The command completed and, for {@code doctor}, GDAL is usable. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Settings were syntactically valid arguments but failed validation. */
  CONFIG_ERROR(4),
  /** Native GDAL could not be loaded or configured. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
