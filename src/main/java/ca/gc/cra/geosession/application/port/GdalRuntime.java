package ca.gc.cra.geosession.application.port;

import java.util.List;

/**
 * <strong>What:</strong> Domain port abstracting the process-wide native GDAL runtime.
 * <p><strong>Why:</strong> GDAL state (config options, the driver table) belongs to the native library, not
 * to this project; the port keeps that boundary explicit and lets tests substitute a recording fake.</p>
 * <p><strong>Role:</strong> Implemented by {@code JniGdalRuntime} and {@code DisabledGdalRuntime}; further
 * implementations plug in through {@link GdalRuntimeProvider}.</p>
 * <p><strong>Thread-safety:</strong> Native GDAL configuration is global; callers serialize configuration
 * changes (the enabler does so under its own lock).</p>
 *
 * @since 0.1.0
 */
public interface GdalRuntime {
  /**
   * Reports whether the native library is loaded and usable.
   *
   * @return {@code true} when native calls can be made; never throws
   */
  boolean isAvailable();

  /**
   * Returns the GDAL release name (for example {@code 3.4.1}).
   *
   * @return release name reported by the native library
   * @throws GdalUnavailableException if the native library cannot be used
   */
  String version() throws GdalUnavailableException;

  /**
   * Sets a process-wide GDAL configuration option.
   *
   * @param key option name, for example {@code CPL_TMPDIR}
   * @param value option value
   * @throws GdalUnavailableException if the native library cannot be used
   */
  void setConfigOption(String key, String value) throws GdalUnavailableException;

  /**
   * Registers every driver compiled into the native library.
   * <p>Calling it repeatedly is safe; GDAL skips drivers that are already registered.</p>
   *
   * @throws GdalUnavailableException if the native library cannot be used
   */
  void registerAll() throws GdalUnavailableException;

  /**
   * Returns the number of registered drivers.
   *
   * @return driver count
   * @throws GdalUnavailableException if the native library cannot be used
   */
  int driverCount() throws GdalUnavailableException;

  /**
   * Returns the short names of the registered drivers in registration order.
   *
   * @return immutable list of driver short names
   * @throws GdalUnavailableException if the native library cannot be used
   */
  List<String> driverNames() throws GdalUnavailableException;
}
