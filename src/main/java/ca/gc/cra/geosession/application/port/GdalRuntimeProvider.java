package ca.gc.cra.geosession.application.port;

/**
 * Service Provider Interface for plugging alternative {@link GdalRuntime}s into the harness.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} registration at {@code
 * META-INF/services/ca.gc.cra.geosession.application.port.GdalRuntimeProvider} and selected by
 * {@link #name()} through the {@code gdal.runtime} harness setting.
 *
 * @since 0.1.0
 */
public interface GdalRuntimeProvider {

  /**
   * Returns the name used to select this provider.
   *
   * @return lower-case provider name; must not be {@code jni} or {@code disabled}
   */
  String name();

  /**
   * Returns the runtime this provider supplies. Providers may return a shared instance.
   *
   * @return runtime instance
   */
  GdalRuntime create();
}
