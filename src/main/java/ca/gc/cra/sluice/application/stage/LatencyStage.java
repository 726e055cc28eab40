package ca.gc.cra.sluice.application.stage;

import ca.gc.cra.sluice.application.port.ChunkStage;
import ca.gc.cra.sluice.application.port.EmitterListener;
import ca.gc.cra.sluice.application.port.SessionScheduler;
import ca.gc.cra.sluice.application.port.SinkListener;
import ca.gc.cra.sluice.application.session.BufferLedger;
import ca.gc.cra.sluice.domain.transfer.AcceptResult;
import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.Watermarks;
import java.util.ArrayDeque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stage that re-emits every chunk unchanged after a fixed delay.
 * <p><strong>Why:</strong> Simulates a slow consumer with scheduler timers only, which forces backpressure
 * deterministically in tests and demonstrations.</p>
 * <p><strong>Role:</strong> Optional middle component between source and sink.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold at most one chunk inside the delay; later chunks wait in a FIFO bounded by the watermarks.</li>
 *   <li>Emit strictly in arrival order; hold an elapsed chunk while suspended.</li>
 *   <li>On abort, cancel the pending timer without running it and notify both sides.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public final class LatencyStage implements ChunkStage {
  private static final Logger log = LoggerFactory.getLogger(LatencyStage.class);

  private enum State { IDLE, OPEN, ENDING, ENDED, ABORTED }

  private final String name;
  private final long delayMillis;
  private final SessionScheduler scheduler;
  private final BufferGauge gauge;
  private final ArrayDeque<Chunk> waiting = new ArrayDeque<>();

  private SinkListener upstream;
  private EmitterListener downstream;
  private State state = State.IDLE;
  private boolean suspended;
  private Chunk delaying;
  private Chunk elapsed;
  private SessionScheduler.Cancellable timer;
  private long bytesForwarded;

  /**
   * Creates a latency stage.
   *
   * @param name component name used in errors and logs
   * @param delayMillis delay applied to each chunk; must not be negative
   * @param watermarks saturation thresholds for the waiting FIFO
   * @param scheduler session scheduler providing timers
   * @param ledger session-wide buffered-byte tally
   */
  public LatencyStage(
      String name,
      long delayMillis,
      Watermarks watermarks,
      SessionScheduler scheduler,
      BufferLedger ledger) {
    this.name = Objects.requireNonNull(name, "name");
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must not be negative");
    }
    this.delayMillis = delayMillis;
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.gauge = new BufferGauge(watermarks, ledger);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void start(SinkListener listener) {
    Objects.requireNonNull(listener, "listener");
    if (upstream != null) {
      throw new IllegalStateException(name + " upstream already bound");
    }
    upstream = listener;
    openWhenBound();
  }

  @Override
  public void start(EmitterListener listener) {
    Objects.requireNonNull(listener, "listener");
    if (downstream != null) {
      throw new IllegalStateException(name + " downstream already bound");
    }
    downstream = listener;
    openWhenBound();
  }

  @Override
  public AcceptResult accept(Chunk chunk) throws TransferException {
    Objects.requireNonNull(chunk, "chunk");
    if (state != State.OPEN) {
      throw TransferException.protocolViolation(name, "accept while " + state);
    }
    if (gauge.isSaturated()) {
      throw TransferException.protocolViolation(name, "accept while saturated");
    }
    waiting.addLast(chunk);
    boolean saturated = gauge.add(chunk.length());
    startNextDelay();
    return AcceptResult.of(saturated);
  }

  @Override
  public void finish() {
    if (state != State.OPEN) {
      return;
    }
    state = State.ENDING;
    scheduler.execute(this::endIfEmpty);
  }

  @Override
  public void suspend() {
    suspended = true;
  }

  @Override
  public void resume() {
    if (!suspended) {
      return;
    }
    suspended = false;
    scheduler.execute(() -> {
      emitElapsed();
      endIfEmpty();
    });
  }

  @Override
  public boolean isSuspended() {
    return suspended;
  }

  @Override
  public void abort(TransferException cause) {
    Objects.requireNonNull(cause, "cause");
    if (state == State.ENDED || state == State.ABORTED) {
      return;
    }
    boolean midDelay = delaying != null;
    state = State.ABORTED;
    if (timer != null) {
      timer.cancel();
      timer = null;
    }
    waiting.clear();
    delaying = null;
    elapsed = null;
    gauge.clear();
    log.debug("{} aborted (midDelay={}): {}", name, midDelay, cause.getMessage());

    TransferException propagated = midDelay ? TransferException.stageCancelled(name, cause) : cause;
    if (upstream != null) {
      upstream.onError(propagated);
    }
    if (downstream != null) {
      downstream.onError(propagated);
    }
  }

  @Override
  public long bufferedBytes() {
    return gauge.buffered();
  }

  @Override
  public long peakBufferedBytes() {
    return gauge.peak();
  }

  @Override
  public long bytesDelivered() {
    return bytesForwarded;
  }

  private void openWhenBound() {
    if (upstream != null && downstream != null && state == State.IDLE) {
      state = State.OPEN;
    }
  }

  private void startNextDelay() {
    if (delaying != null || elapsed != null || waiting.isEmpty()) {
      return;
    }
    delaying = waiting.pollFirst();
    timer = scheduler.schedule(this::delayElapsed, delayMillis);
  }

  private void delayElapsed() {
    timer = null;
    if (state == State.ABORTED || delaying == null) {
      return;
    }
    elapsed = delaying;
    delaying = null;
    emitElapsed();
    endIfEmpty();
  }

  private void emitElapsed() {
    if (suspended || elapsed == null || state == State.ABORTED) {
      return;
    }
    Chunk chunk = elapsed;
    elapsed = null;
    bytesForwarded += chunk.length();
    downstream.onChunk(chunk);
    if (state == State.ABORTED) {
      return;
    }
    if (gauge.release(chunk.length())) {
      upstream.onDrained();
    }
    startNextDelay();
  }

  private void endIfEmpty() {
    if (state != State.ENDING || suspended) {
      return;
    }
    if (delaying != null || elapsed != null || !waiting.isEmpty()) {
      return;
    }
    state = State.ENDED;
    log.debug("{} forwarded {} bytes and ended", name, bytesForwarded);
    downstream.onEnd();
    upstream.onFinished();
  }
}
