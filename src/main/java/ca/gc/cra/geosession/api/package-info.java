/**
 * Command-line entry points for checking a GeoSession GDAL installation.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes the
 * GDAL enabler.</p>
 * <p><strong>Output:</strong> Reports go to stdout through {@link ca.gc.cra.geosession.api.CliPrinter}; diagnostics go
 * to the log.</p>
 */
package ca.gc.cra.geosession.api;
