package ca.gc.cra.geosession.application.gdal;

import ca.gc.cra.geosession.config.GeoSettings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the process-wide GDAL config options applied when GDAL is enabled for a session.
 *
 * <p>Scratch files, PAM sidecars, and the GDAL log are all routed into {@link GeoSettings#tmpDir()} so a
 * session never writes next to the rasters it reads.</p>
 *
 * @since 0.1.0
 */
public final class GdalOptions {
  public static final String CPL_TMPDIR = "CPL_TMPDIR";
  public static final String GDAL_PAM_PROXY_DIR = "GDAL_PAM_PROXY_DIR";
  public static final String CPL_LOG = "CPL_LOG";
  public static final String GDAL_LOG_FILE = "gdal.log";

  private GdalOptions() {}

  /**
   * Returns the options in the order they are applied.
   *
   * @param settings session settings; must not be {@code null}
   * @return unmodifiable, insertion-ordered option map
   */
  public static Map<String, String> forSettings(GeoSettings settings) {
    Objects.requireNonNull(settings, "settings");
    String tmpDir = settings.tmpDir().toString();
    Map<String, String> options = new LinkedHashMap<>();
    options.put("GDAL_VRT_ENABLE_PYTHON", "YES");
    options.put("GDAL_DISABLE_READDIR_ON_OPEN", "TRUE");
    options.put(CPL_TMPDIR, tmpDir);
    options.put(GDAL_PAM_PROXY_DIR, tmpDir);
    options.put("GDAL_PAM_ENABLED", "YES");
    options.put("CPL_VSIL_USE_TEMP_FILE_FOR_RANDOM_WRITE", "NO");
    options.put(CPL_LOG, settings.tmpDir().resolve(GDAL_LOG_FILE).toString());
    options.put("GDAL_CACHEMAX", "512");
    options.put("GDAL_NUM_THREADS", "ALL_CPUS");
    return Collections.unmodifiableMap(options);
  }
}
