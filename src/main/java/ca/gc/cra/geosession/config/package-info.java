/**
 * Session settings and harness configuration.
 * <p><strong>Role:</strong> Typed readers for the extension's session keyspace and the layered
 * (defaults, YAML, system properties) harness configuration.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Values are validated with {@code ca.gc.cra.geosession.validation} before use.</p>
 */
package ca.gc.cra.geosession.config;
