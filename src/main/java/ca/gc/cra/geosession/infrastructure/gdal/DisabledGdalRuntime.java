package ca.gc.cra.geosession.infrastructure.gdal;

import ca.gc.cra.geosession.application.port.GdalRuntime;
import ca.gc.cra.geosession.application.port.GdalUnavailableException;
import java.util.List;

/**
 * Runtime used when native GDAL is deliberately switched off ({@code gdal.runtime=disabled}).
 * Every native operation throws so callers take their "GDAL unavailable" path without loading JNI.
 */
public final class DisabledGdalRuntime implements GdalRuntime {
  static final String MESSAGE = "GDAL runtime disabled";

  /**
   * Creates a disabled runtime.
   */
  public DisabledGdalRuntime() {}

  /**
   * Always {@code false}.
   *
   * @return {@code false}
   */
  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public String version() throws GdalUnavailableException {
    throw new GdalUnavailableException(MESSAGE);
  }

  @Override
  public void setConfigOption(String key, String value) throws GdalUnavailableException {
    throw new GdalUnavailableException(MESSAGE);
  }

  @Override
  public void registerAll() throws GdalUnavailableException {
    throw new GdalUnavailableException(MESSAGE);
  }

  @Override
  public int driverCount() throws GdalUnavailableException {
    throw new GdalUnavailableException(MESSAGE);
  }

  @Override
  public List<String> driverNames() throws GdalUnavailableException {
    throw new GdalUnavailableException(MESSAGE);
  }
}
