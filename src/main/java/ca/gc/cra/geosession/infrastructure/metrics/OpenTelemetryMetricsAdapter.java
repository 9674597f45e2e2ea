package ca.gc.cra.geosession.infrastructure.metrics;

import ca.gc.cra.geosession.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Metrics adapter that forwards GeoSession counters and histograms to OpenTelemetry.
 * Instruments are created lazily and cached per metric key.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("geosession.metric.key");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the given exporter.
   *
   * @param exporter {@code otlp} to export over OTLP/gRPC; anything else yields a no-op meter
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(key, k -> new CounterInstrument(
        meter.counterBuilder(k).setUnit("1").setDescription("GeoSession counter for " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    HistogramInstrument instrument = histograms.computeIfAbsent(key, k -> new HistogramInstrument(
        meter.histogramBuilder(k).ofLongs().setDescription("GeoSession observation for " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.histogram().record(value, instrument.attributes());
  }

  /**
   * Reports whether metrics are discarded.
   *
   * @return {@code true} when no exporter is configured
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
