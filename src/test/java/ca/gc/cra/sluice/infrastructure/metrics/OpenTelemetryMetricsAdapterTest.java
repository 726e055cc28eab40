package ca.gc.cra.sluice.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
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
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private Optional<MetricData> metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("transfer.backpressure.events");
    adapter.increment("transfer.backpressure.events");
    adapter.flush();

    MetricData counter = metric("transfer.backpressure.events").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("transfer.backpressure.events",
        point.getAttributes().get(AttributeKey.stringKey("sluice.metric.key")));
    assertEquals("sluice", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("transfer.bytes.consumed", 100);
    adapter.observe("transfer.bytes.consumed", 300);

    MetricData histogram = metric("transfer.bytes.consumed").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum());
  }

  @Test
  void instrumentNamesAreNormalized() {
    assertEquals("transfer.session.failed.sink_write",
        OpenTelemetryMetricsAdapter.instrumentName("transfer.session.failed.sink_write"));
    assertEquals("bad_name", OpenTelemetryMetricsAdapter.instrumentName("Bad Name"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.instrumentName("9lives"));
    assertEquals("sluice.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
  }

  @Test
  void noopHandleAcceptsCallsWithoutExporting() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle.noop())) {
      noop.increment("transfer.session.completed");
      noop.observe("transfer.bytes.consumed", 1);
      noop.flush();
      assertTrue(noop.isNoop());
    }
  }
}
