package ca.gc.cra.geosession.infrastructure.gdal;

import ca.gc.cra.geosession.application.port.GdalRuntime;
import ca.gc.cra.geosession.application.port.GdalUnavailableException;
import java.util.ArrayList;
import java.util.List;
import org.gdal.gdal.Driver;
import org.gdal.gdal.gdal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GDAL runtime backed by the official JNI bindings ({@code org.gdal.gdal.gdal}).
 *
 * <p>The bindings load {@code gdalalljni} from {@code java.library.path} when first touched. A missing or
 * mismatched native library surfaces as a {@link LinkageError}, which this adapter converts into
 * {@link GdalUnavailableException}. The availability probe runs once per instance.</p>
 *
 * @since 0.1.0
 */
public final class JniGdalRuntime implements GdalRuntime {
  private static final Logger log = LoggerFactory.getLogger(JniGdalRuntime.class);

  private final Object probeLock = new Object();
  private volatile Boolean available;
  private volatile Throwable loadFailure;

  /**
   * Creates a runtime; the native library is not touched until first use.
   */
  public JniGdalRuntime() {}

  @Override
  public boolean isAvailable() {
    Boolean cached = available;
    if (cached != null) {
      return cached;
    }
    synchronized (probeLock) {
      if (available == null) {
        try {
          String release = gdal.VersionInfo("RELEASE_NAME");
          log.debug("Native GDAL {} loaded", release);
          available = Boolean.TRUE;
        } catch (LinkageError ex) {
          loadFailure = ex;
          available = Boolean.FALSE;
          log.warn("Native GDAL library unavailable: {}", ex.toString());
        }
      }
      return available;
    }
  }

  @Override
  public String version() throws GdalUnavailableException {
    requireAvailable();
    try {
      return gdal.VersionInfo("RELEASE_NAME");
    } catch (LinkageError ex) {
      throw new GdalUnavailableException("gdal.VersionInfo failed", ex);
    }
  }

  @Override
  public void setConfigOption(String key, String value) throws GdalUnavailableException {
    requireAvailable();
    try {
      gdal.SetConfigOption(key, value);
    } catch (LinkageError ex) {
      throw new GdalUnavailableException("gdal.SetConfigOption failed for " + key, ex);
    }
  }

  @Override
  public void registerAll() throws GdalUnavailableException {
    requireAvailable();
    try {
      gdal.AllRegister();
    } catch (LinkageError ex) {
      throw new GdalUnavailableException("gdal.AllRegister failed", ex);
    }
  }

  @Override
  public int driverCount() throws GdalUnavailableException {
    requireAvailable();
    try {
      return gdal.GetDriverCount();
    } catch (LinkageError ex) {
      throw new GdalUnavailableException("gdal.GetDriverCount failed", ex);
    }
  }

  @Override
  public List<String> driverNames() throws GdalUnavailableException {
    requireAvailable();
    try {
      int count = gdal.GetDriverCount();
      List<String> names = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        Driver driver = gdal.GetDriver(i);
        if (driver != null) {
          names.add(driver.getShortName());
        }
      }
      return List.copyOf(names);
    } catch (LinkageError ex) {
      throw new GdalUnavailableException("Listing GDAL drivers failed", ex);
    }
  }

  private void requireAvailable() throws GdalUnavailableException {
    if (!isAvailable()) {
      throw new GdalUnavailableException("Native GDAL library is not available", loadFailure);
    }
  }
}
