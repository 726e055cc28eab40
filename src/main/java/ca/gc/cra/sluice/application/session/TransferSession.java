package ca.gc.cra.sluice.application.session;

import ca.gc.cra.sluice.application.port.SessionScheduler;
import ca.gc.cra.sluice.application.port.TransferObserver;
import ca.gc.cra.sluice.domain.transfer.BackpressureEvent;
import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Mutable counters and terminal outcome of one transfer.
 * <p><strong>Why:</strong> Both bridge strategies need the same bookkeeping: backpressure numbering, progress
 * marks, elapsed time and a first-error-wins resolution.</p>
 * <p><strong>Role:</strong> Created per session by the use cases; discarded once the session resolves and the
 * caller holds the immutable {@link TransferReport}.</p>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 * <p><strong>Observability:</strong> Forwards every event to the injected {@link TransferObserver}.</p>
 *
 * @since 0.1.0
 */
public final class TransferSession {
  private static final Logger log = LoggerFactory.getLogger(TransferSession.class);
  static final long PROGRESS_STEP_BYTES = 10L * 1024 * 1024;

  private final String id;
  private final SessionScheduler scheduler;
  private final TransferObserver observer;
  private final BufferLedger ledger;

  private long startNanos = -1L;
  private long backpressureEvents;
  private long bytesProduced;
  private long nextProgressMark = PROGRESS_STEP_BYTES;
  private TransferException failure;
  private TransferReport report;

  /**
   * Creates a session.
   *
   * @param id session identifier used in logs and events
   * @param scheduler clock source for elapsed time
   * @param observer reporting collaborator
   * @param ledger session-wide buffered-byte tally shared with the components
   */
  public TransferSession(
      String id, SessionScheduler scheduler, TransferObserver observer, BufferLedger ledger) {
    this.id = Objects.requireNonNull(id, "id");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.observer = Objects.requireNonNull(observer, "observer");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
  }

  /**
   * Generates a short random session identifier.
   *
   * @return eight hexadecimal characters
   */
  public static String newId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }

  public String id() {
    return id;
  }

  /** Starts the elapsed-time clock; only the first call has an effect. */
  public void begin() {
    if (startNanos < 0) {
      startNanos = scheduler.nowNanos();
    }
  }

  /**
   * Counts a chunk leaving the source and publishes progress every 10 MiB.
   *
   * @param chunk chunk emitted by the source
   */
  public void recordProduced(Chunk chunk) {
    bytesProduced += chunk.length();
    while (bytesProduced >= nextProgressMark) {
      nextProgressMark += PROGRESS_STEP_BYTES;
      observer.onProgress(id, bytesProduced);
    }
  }

  /**
   * Numbers and publishes a backpressure event.
   *
   * @param hop hop that saturated
   * @param offset stream offset at which the upstream was suspended
   * @return published event
   */
  public BackpressureEvent recordBackpressure(String hop, long offset) {
    backpressureEvents++;
    BackpressureEvent event = new BackpressureEvent(id, hop, backpressureEvents, offset);
    observer.onBackpressure(event);
    return event;
  }

  /**
   * Resolves the session as failed unless it already resolved.
   *
   * @param error failure to record
   * @return {@code true} if this call resolved the session
   */
  public boolean fail(TransferException error) {
    Objects.requireNonNull(error, "error");
    if (isResolved()) {
      log.debug("Session {} already resolved; ignoring {}", id, error.getMessage());
      return false;
    }
    failure = error;
    observer.onSessionError(id, error.kind(), error.stage());
    return true;
  }

  /**
   * Resolves the session as successful.
   *
   * @param bytesConsumed bytes written by the terminal sink
   * @param peakBufferedByComponent per-component buffered-byte peaks
   * @return final report
   * @throws IllegalStateException if the session already resolved
   */
  public TransferReport complete(long bytesConsumed, Map<String, Long> peakBufferedByComponent) {
    if (isResolved()) {
      throw new IllegalStateException("session " + id + " already resolved");
    }
    long elapsedNanos = startNanos < 0 ? 0L : scheduler.nowNanos() - startNanos;
    report = new TransferReport(
        id,
        bytesProduced,
        bytesConsumed,
        backpressureEvents,
        Duration.ofNanos(elapsedNanos),
        ledger.peak(),
        peakBufferedByComponent);
    observer.onSessionComplete(report);
    return report;
  }

  public boolean isResolved() {
    return failure != null || report != null;
  }

  public Optional<TransferException> failure() {
    return Optional.ofNullable(failure);
  }

  public Optional<TransferReport> report() {
    return Optional.ofNullable(report);
  }

  public long backpressureEvents() {
    return backpressureEvents;
  }

  public long bytesProduced() {
    return bytesProduced;
  }

  public BufferLedger ledger() {
    return ledger;
  }
}
