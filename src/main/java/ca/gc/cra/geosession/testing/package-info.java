/**
 * JUnit 5 harness: shared Spark sessions per test class, optionally with native GDAL enabled.
 * <p><strong>Usage:</strong> Annotate a test class with {@link ca.gc.cra.geosession.testing.SparkSessionTest} or
 * {@link ca.gc.cra.geosession.testing.GdalSparkSessionTest} and declare a {@code SparkSession} parameter.</p>
 * <p><strong>Configuration:</strong> {@code geosession-test.yaml} on the test classpath, overridden by
 * {@code -Dgeosession.*} system properties.</p>
 */
package ca.gc.cra.geosession.testing;
