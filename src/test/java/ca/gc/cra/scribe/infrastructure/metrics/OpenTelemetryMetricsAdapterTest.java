package ca.gc.cra.scribe.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private SdkMeterProvider provider;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    provider = SdkMeterProvider.builder().registerMetricReader(reader).build();
    adapter = new OpenTelemetryMetricsAdapter(provider.get("scribe-test"));
  }

  @AfterEach
  void tearDown() {
    provider.close();
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("events.emitted");
    adapter.increment("events.emitted");
    adapter.increment("events.emitted");

    MetricData counter = find(reader.collectAllMetrics(), "events.emitted").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("events.emitted",
        point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("state.snapshot.keys", 4);
    adapter.observe("state.snapshot.keys", 6);

    MetricData histogram = find(reader.collectAllMetrics(), "state.snapshot.keys").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0, point.getSum());
  }

  @Test
  void unsafeNamesAreSanitized() {
    adapter.increment("Registry Components/Failed");

    assertTrue(find(reader.collectAllMetrics(), "registry_components_failed").isPresent());
    assertEquals("m1.metric", OpenTelemetryMetricsAdapter.sanitizeName("1.metric"));
    assertEquals(OpenTelemetryMetricsAdapter.FALLBACK_METRIC_NAME, OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
