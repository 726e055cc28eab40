package ca.gc.cra.sluice.infrastructure.report;

import ca.gc.cra.sluice.application.port.TransferObserver;
import ca.gc.cra.sluice.domain.transfer.BackpressureEvent;
import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders session events as log lines.
 * <p>Backpressure is logged for the first event and then every {@code backpressureLogInterval}-th event so a
 * long transfer does not flood the log; every event is still visible at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class LoggingTransferObserver implements TransferObserver {
  private static final Logger log = LoggerFactory.getLogger(LoggingTransferObserver.class);
  static final int DEFAULT_BACKPRESSURE_LOG_INTERVAL = 100;

  private final int backpressureLogInterval;

  public LoggingTransferObserver() {
    this(DEFAULT_BACKPRESSURE_LOG_INTERVAL);
  }

  /**
   * Creates an observer.
   *
   * @param backpressureLogInterval log every n-th backpressure event at INFO; must be positive
   */
  public LoggingTransferObserver(int backpressureLogInterval) {
    if (backpressureLogInterval <= 0) {
      throw new IllegalArgumentException("backpressureLogInterval must be positive");
    }
    this.backpressureLogInterval = backpressureLogInterval;
  }

  @Override
  public void onBackpressure(BackpressureEvent event) {
    if (event.count() == 1 || event.count() % backpressureLogInterval == 0) {
      log.info("Backpressure #{} on {} at offset {} (session {})",
          event.count(), event.hop(), event.offset(), event.sessionId());
    } else {
      log.debug("Backpressure #{} on {} at offset {}", event.count(), event.hop(), event.offset());
    }
  }

  @Override
  public void onProgress(String sessionId, long bytesProduced) {
    log.info("Session {} progress: {} MiB produced", sessionId, bytesProduced / (1024 * 1024));
  }

  @Override
  public void onSessionComplete(TransferReport report) {
    StringJoiner peaks = new StringJoiner(", ", "{", "}");
    for (Map.Entry<String, Long> entry : report.peakBufferedByComponent().entrySet()) {
      peaks.add(entry.getKey() + "=" + entry.getValue());
    }
    log.info(
        "Session {} complete: produced={} consumed={} backpressureEvents={} elapsedMs={} peakTotal={} peaks={}",
        report.sessionId(),
        report.bytesProduced(),
        report.bytesConsumed(),
        report.backpressureEvents(),
        report.elapsed().toMillis(),
        report.peakBufferedTotal(),
        peaks);
  }

  @Override
  public void onSessionError(String sessionId, TransferErrorKind kind, String stage) {
    log.error("Session {} failed: {} in {}", sessionId, kind, stage);
  }
}
