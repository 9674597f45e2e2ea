package ca.gc.cra.geosession.application.port;

/**
 * Checked exception thrown when the native GDAL library cannot be loaded or refuses an operation.
 *
 * @since 0.1.0
 */
public final class GdalUnavailableException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public GdalUnavailableException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause, typically a {@link LinkageError} from the JNI bindings
   */
  public GdalUnavailableException(String msg, Throwable cause) { super(msg, cause); }
}
