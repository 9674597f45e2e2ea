/**
 * Spark adapters: session configuration access and local session lifecycle.
 * <p><strong>Role:</strong> Adapter layer behind {@link ca.gc.cra.geosession.application.port.SessionConf}.</p>
 */
package ca.gc.cra.geosession.infrastructure.spark;
