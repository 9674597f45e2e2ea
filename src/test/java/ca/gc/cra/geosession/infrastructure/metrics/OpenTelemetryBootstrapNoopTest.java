package ca.gc.cra.geosession.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {

  @Test
  void exporterNoneFallsBackToNoop() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter("none")) {
      adapter.increment("gdal.enable.attempt");
      assertTrue(adapter.isNoop(), "Expected noop metrics when exporter=none");
    }
  }

  @Test
  void unknownExporterIsTreatedAsNone() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(null);
    assertTrue(result.isNoop());
    result.close();
  }
}
