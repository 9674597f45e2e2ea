package ca.gc.cra.geosession.infrastructure.spark;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geosession.config.GeoConfigKeys;
import ca.gc.cra.geosession.config.GeoSettings;
import ca.gc.cra.geosession.config.IndexSystemId;
import ca.gc.cra.geosession.testing.SparkSessionTest;
import java.util.Optional;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.Test;

@SparkSessionTest
class SparkSessionConfTest {

  @Test
  void setValuesAreVisibleThroughRuntimeConfig(SparkSession spark) {
    SparkSessionConf conf = new SparkSessionConf(spark);

    conf.set(GeoConfigKeys.INDEX_SYSTEM, "BNG");

    assertEquals(Optional.of("BNG"), conf.get(GeoConfigKeys.INDEX_SYSTEM));
    assertEquals("BNG", spark.conf().get(GeoConfigKeys.INDEX_SYSTEM));
    assertEquals(IndexSystemId.BNG, GeoSettings.from(conf).indexSystem());
  }

  @Test
  void missingKeyIsEmptyAndFallsBackToDefault(SparkSession spark) {
    SparkSessionConf conf = new SparkSessionConf(spark);

    assertFalse(conf.get("spark.databricks.labs.mosaic.unset").isPresent());
    assertEquals("fallback", conf.get("spark.databricks.labs.mosaic.unset", "fallback"));
  }

  @Test
  void nativeFlagIsOffInPlainSession(SparkSession spark) {
    assertFalse(GeoSettings.from(new SparkSessionConf(spark)).gdalNative());
    assertTrue(spark.conf().getOption(GeoConfigKeys.GDAL_NATIVE).isEmpty());
  }
}
