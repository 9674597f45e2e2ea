/**
 * <strong>Purpose:</strong> Validation helpers used while parsing session settings and harness configuration.
 * <p><strong>Role:</strong> Domain support; rejects invalid inputs before values reach GDAL or Spark.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geosession.validation;
