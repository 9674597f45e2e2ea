package ca.gc.cra.geosession.application.gdal;

/**
 * Outcome of {@link GdalEnabler#enable(ca.gc.cra.geosession.application.port.SessionConf)}.
 *
 * @since 0.1.0
 */
public enum GdalEnablement {
  /** GDAL was configured and its drivers registered by this call. */
  ENABLED,
  /** GDAL had already been enabled; only the checkpoint configuration was refreshed. */
  ALREADY_ENABLED
}
