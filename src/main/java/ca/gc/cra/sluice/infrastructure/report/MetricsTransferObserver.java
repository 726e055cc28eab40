package ca.gc.cra.sluice.infrastructure.report;

import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.TransferObserver;
import ca.gc.cra.sluice.domain.transfer.BackpressureEvent;
import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import java.util.Locale;

/**
 * Translates session events into {@code transfer.*} metrics.
 *
 * @since 0.1.0
 */
public final class MetricsTransferObserver implements TransferObserver {
  static final String BACKPRESSURE_EVENTS = "transfer.backpressure.events";
  static final String SESSION_COMPLETED = "transfer.session.completed";
  static final String SESSION_FAILED = "transfer.session.failed";
  static final String BYTES_CONSUMED = "transfer.bytes.consumed";
  static final String SESSION_DURATION = "transfer.session.durationMillis";
  static final String PEAK_BUFFERED = "transfer.buffer.peakBytes";

  private final MetricsPort metrics;

  /**
   * Creates an observer.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public MetricsTransferObserver(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void onBackpressure(BackpressureEvent event) {
    metrics.increment(BACKPRESSURE_EVENTS);
  }

  @Override
  public void onSessionComplete(TransferReport report) {
    metrics.increment(SESSION_COMPLETED);
    metrics.observe(BYTES_CONSUMED, report.bytesConsumed());
    metrics.observe(SESSION_DURATION, report.elapsed().toMillis());
    metrics.observe(PEAK_BUFFERED, report.peakBufferedBytes());
  }

  @Override
  public void onSessionError(String sessionId, TransferErrorKind kind, String stage) {
    metrics.increment(SESSION_FAILED);
    metrics.increment(SESSION_FAILED + "." + kind.name().toLowerCase(Locale.ROOT));
  }
}
