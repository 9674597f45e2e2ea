/**
 * <strong>Purpose:</strong> Logging utilities that tune Logback verbosity for sessions and the CLI.
 * <p><strong>Concurrency:</strong> Stateless helpers; level changes are synchronized by Logback.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geosession.logging;
