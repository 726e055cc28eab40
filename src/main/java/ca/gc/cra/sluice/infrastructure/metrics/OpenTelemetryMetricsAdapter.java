package ca.gc.cra.sluice.infrastructure.metrics;

import ca.gc.cra.sluice.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Role:</strong> Created once per process by the CLI and shared by every session's
 * {@code MetricsTransferObserver}.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for parallel
 * sessions.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("sluice.metric.key");
  private static final String FALLBACK_NAME = "sluice.metric";

  private final OpenTelemetryBootstrap.Handle handle;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from {@code otel.*} system properties and {@code OTEL_*} variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  /**
   * Reports whether metrics are actually exported.
   *
   * @return {@code true} when running against the no-op meter
   */
  public boolean isNoop() {
    return handle.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::counter).add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::histogram).record(value, Attributes.of(METRIC_KEY, key));
  }

  /** Pushes pending observations to the exporter. */
  public void flush() {
    handle.forceFlush();
  }

  /** Flushes and shuts the meter provider down. */
  @Override
  public void close() {
    handle.close();
  }

  private LongCounter counter(String key) {
    String name = instrumentName(key);
    return handle.meter().counterBuilder(name).setUnit("1").setDescription("sluice counter " + key).build();
  }

  private LongHistogram histogram(String key) {
    String name = instrumentName(key);
    return handle.meter().histogramBuilder(name).ofLongs().setDescription("sluice observation " + key).build();
  }

  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Instrument name for '{}' normalized to '{}'", key, result);
    }
    return result;
  }
}
