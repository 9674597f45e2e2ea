/**
 * GDAL enablement for sessions: config options, checkpoint directories, and the idempotent enable entry point.
 * <p><strong>Concurrency:</strong> GDAL configuration is process-wide; {@link
 * ca.gc.cra.geosession.application.gdal.GdalEnabler} serializes it.</p>
 * <p><strong>Metrics:</strong> Publishes {@code gdal.enable.*} and {@code gdal.register.calls}.</p>
 */
package ca.gc.cra.geosession.application.gdal;
