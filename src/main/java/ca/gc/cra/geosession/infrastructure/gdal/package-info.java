/**
 * GDAL runtime adapters: JNI bindings, a disabled stand-in, and provider lookup.
 * <p><strong>Role:</strong> Adapter layer behind {@link ca.gc.cra.geosession.application.port.GdalRuntime}.</p>
 * <p><strong>Concurrency:</strong> Native GDAL state is process-wide; adapters hold no per-call state.</p>
 */
package ca.gc.cra.geosession.infrastructure.gdal;
