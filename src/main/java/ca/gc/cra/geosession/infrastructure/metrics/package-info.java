/**
 * Metrics adapter bridging {@link ca.gc.cra.geosession.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code gdal.*} namespace.</p>
 */
package ca.gc.cra.geosession.infrastructure.metrics;
