package ca.gc.cra.geosession.config;

import ca.gc.cra.geosession.application.port.SessionConf;
import ca.gc.cra.geosession.validation.Paths;
import ca.gc.cra.geosession.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable view of the geospatial settings carried by a session's configuration.
 * <p><strong>Why:</strong> The enabler, the harness, and the doctor CLI all need the same typed reading of the
 * {@link GeoConfigKeys} keyspace, with identical defaults and validation.</p>
 * <p><strong>Role:</strong> Configuration record built from a {@link SessionConf} or a flat map.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param gdalNative whether raster operations use the native GDAL backend
 * @param rasterCheckpoint directory for raster checkpoints
 * @param useCheckpoint whether raster results are checkpointed
 * @param tmpPrefix prefix under which GDAL scratch files are written
 * @param indexSystem configured grid index system
 * @param geometryApi configured geometry backend
 * @since 0.1.0
 */
public record GeoSettings(
    boolean gdalNative,
    Path rasterCheckpoint,
    boolean useCheckpoint,
    Path tmpPrefix,
    IndexSystemId indexSystem,
    GeometryApi geometryApi) {

  /** Directory name appended to {@link #tmpPrefix()} for GDAL scratch files. */
  public static final String TMP_DIR_NAME = "mosaic_tmp";

  /**
   * Validates record components.
   *
   * @throws NullPointerException if any reference component is {@code null}
   */
  public GeoSettings {
    Objects.requireNonNull(rasterCheckpoint, "rasterCheckpoint");
    Objects.requireNonNull(tmpPrefix, "tmpPrefix");
    Objects.requireNonNull(indexSystem, "indexSystem");
    Objects.requireNonNull(geometryApi, "geometryApi");
  }

  /**
   * Reads settings from a session configuration, applying defaults for unset keys.
   *
   * @param conf session configuration; must not be {@code null}
   * @return parsed settings
   * @throws IllegalArgumentException if any configured value is invalid
   */
  public static GeoSettings from(SessionConf conf) {
    Objects.requireNonNull(conf, "conf");
    return parse(
        conf.get(GeoConfigKeys.GDAL_NATIVE, GeoConfigKeys.GDAL_NATIVE_DEFAULT),
        conf.get(GeoConfigKeys.RASTER_CHECKPOINT, GeoConfigKeys.RASTER_CHECKPOINT_DEFAULT),
        conf.get(GeoConfigKeys.RASTER_USE_CHECKPOINT, GeoConfigKeys.RASTER_USE_CHECKPOINT_DEFAULT),
        conf.get(GeoConfigKeys.RASTER_TMP_PREFIX, GeoConfigKeys.RASTER_TMP_PREFIX_DEFAULT),
        conf.get(GeoConfigKeys.INDEX_SYSTEM, GeoConfigKeys.INDEX_SYSTEM_DEFAULT),
        conf.get(GeoConfigKeys.GEOMETRY_API, GeoConfigKeys.GEOMETRY_API_DEFAULT));
  }

  /**
   * Reads settings from a flat key/value map, applying defaults for missing keys.
   *
   * @param map configuration entries keyed by {@link GeoConfigKeys}; must not be {@code null}
   * @return parsed settings
   * @throws IllegalArgumentException if any configured value is invalid
   */
  public static GeoSettings fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    return parse(
        map.getOrDefault(GeoConfigKeys.GDAL_NATIVE, GeoConfigKeys.GDAL_NATIVE_DEFAULT),
        map.getOrDefault(GeoConfigKeys.RASTER_CHECKPOINT, GeoConfigKeys.RASTER_CHECKPOINT_DEFAULT),
        map.getOrDefault(GeoConfigKeys.RASTER_USE_CHECKPOINT, GeoConfigKeys.RASTER_USE_CHECKPOINT_DEFAULT),
        map.getOrDefault(GeoConfigKeys.RASTER_TMP_PREFIX, GeoConfigKeys.RASTER_TMP_PREFIX_DEFAULT),
        map.getOrDefault(GeoConfigKeys.INDEX_SYSTEM, GeoConfigKeys.INDEX_SYSTEM_DEFAULT),
        map.getOrDefault(GeoConfigKeys.GEOMETRY_API, GeoConfigKeys.GEOMETRY_API_DEFAULT));
  }

  /**
   * Returns the defaults applied when no keys are configured.
   *
   * @return default settings
   */
  public static GeoSettings defaults() {
    return fromMap(Map.of());
  }

  /**
   * Returns the directory GDAL uses for scratch files and its log.
   *
   * @return {@code <tmpPrefix>/mosaic_tmp}
   */
  public Path tmpDir() {
    return tmpPrefix.resolve(TMP_DIR_NAME);
  }

  private static GeoSettings parse(
      String gdalNative,
      String checkpoint,
      String useCheckpoint,
      String tmpPrefix,
      String indexSystem,
      String geometryApi) {
    return new GeoSettings(
        Strings.parseBoolean(GeoConfigKeys.GDAL_NATIVE, gdalNative, false),
        Paths.parse(GeoConfigKeys.RASTER_CHECKPOINT, checkpoint),
        Strings.parseBoolean(GeoConfigKeys.RASTER_USE_CHECKPOINT, useCheckpoint, false),
        Paths.parse(GeoConfigKeys.RASTER_TMP_PREFIX, tmpPrefix),
        IndexSystemId.fromString(indexSystem),
        GeometryApi.fromString(geometryApi));
  }
}
