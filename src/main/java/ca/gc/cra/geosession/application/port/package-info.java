/**
 * Ports separating session bootstrap logic from Spark, native GDAL, and the metrics backend.
 * <p><strong>Role:</strong> Domain boundary; adapters live under {@code ca.gc.cra.geosession.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> GDAL configuration is process-wide; see {@link ca.gc.cra.geosession.application.port.GdalRuntime}.</p>
 */
package ca.gc.cra.geosession.application.port;
