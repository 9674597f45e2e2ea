package ca.gc.cra.geosession.application.gdal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.geosession.config.GeoConfigKeys;
import ca.gc.cra.geosession.config.GeoSettings;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GdalOptionsTest {

  @Test
  void optionsPointScratchAndLogAtTmpDir() {
    GeoSettings settings = GeoSettings.fromMap(Map.of(GeoConfigKeys.RASTER_TMP_PREFIX, "/scratch"));

    Map<String, String> options = GdalOptions.forSettings(settings);

    assertEquals("/scratch/mosaic_tmp", options.get(GdalOptions.CPL_TMPDIR));
    assertEquals("/scratch/mosaic_tmp", options.get(GdalOptions.GDAL_PAM_PROXY_DIR));
    assertEquals("/scratch/mosaic_tmp/gdal.log", options.get(GdalOptions.CPL_LOG));
    assertEquals("512", options.get("GDAL_CACHEMAX"));
    assertEquals("ALL_CPUS", options.get("GDAL_NUM_THREADS"));
  }

  @Test
  void optionsAreOrderedAndImmutable() {
    Map<String, String> options = GdalOptions.forSettings(GeoSettings.defaults());

    assertEquals(List.of(
        "GDAL_VRT_ENABLE_PYTHON",
        "GDAL_DISABLE_READDIR_ON_OPEN",
        "CPL_TMPDIR",
        "GDAL_PAM_PROXY_DIR",
        "GDAL_PAM_ENABLED",
        "CPL_VSIL_USE_TEMP_FILE_FOR_RANDOM_WRITE",
        "CPL_LOG",
        "GDAL_CACHEMAX",
        "GDAL_NUM_THREADS"), List.copyOf(options.keySet()));
    assertThrows(UnsupportedOperationException.class, () -> options.put("GDAL_CACHEMAX", "1"));
  }
}
