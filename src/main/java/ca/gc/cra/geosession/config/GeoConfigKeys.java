package ca.gc.cra.geosession.config;

/**
 * Session configuration keys understood by the geospatial extension, with their defaults.
 *
 * <p>The keys live in the extension's {@code spark.databricks.labs.mosaic} keyspace so that sessions
 * configured by this project and by notebooks running the extension read the same settings.</p>
 *
 * @since 0.1.0
 */
public final class GeoConfigKeys {
  /** Switches raster operations to the native GDAL backend. */
  public static final String GDAL_NATIVE = "spark.databricks.labs.mosaic.gdal.native";
  /** Directory for intermediate raster checkpoints. */
  public static final String RASTER_CHECKPOINT = "spark.databricks.labs.mosaic.raster.checkpoint";
  /** Whether raster results are written to {@link #RASTER_CHECKPOINT}. */
  public static final String RASTER_USE_CHECKPOINT = "spark.databricks.labs.mosaic.raster.use.checkpoint";
  /** Prefix under which GDAL scratch files are written. */
  public static final String RASTER_TMP_PREFIX = "spark.databricks.labs.mosaic.raster.tmp.prefix";
  /** Grid index system identifier. */
  public static final String INDEX_SYSTEM = "spark.databricks.labs.mosaic.index.system";
  /** Geometry backend identifier. */
  public static final String GEOMETRY_API = "spark.databricks.labs.mosaic.geometry.api";
  /** Set to {@code true} on a session once GDAL has been enabled for it. */
  public static final String GDAL_ENABLED = "spark.mosaic.gdal.native.enabled";

  public static final String GDAL_NATIVE_DEFAULT = "false";
  public static final String RASTER_CHECKPOINT_DEFAULT = "/dbfs/tmp/mosaic/raster/checkpoint";
  public static final String RASTER_USE_CHECKPOINT_DEFAULT = "false";
  public static final String RASTER_TMP_PREFIX_DEFAULT = "/tmp";
  public static final String INDEX_SYSTEM_DEFAULT = "H3";
  public static final String GEOMETRY_API_DEFAULT = "JTS";

  private GeoConfigKeys() {}
}
