package ca.gc.cra.sluice.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
  }

  @Test
  void consumesTelemetryKeysIntoSystemProperties() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP", "otelEndpoint", "http://collector:4317", "in", "a.txt"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertFalse(args.containsKey("metricsExporter"));
    assertEquals(Map.of("in", "a.txt"), args);
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "statsd"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://host"))));
  }
}
