package ca.gc.cra.sluice.application.stage;

import ca.gc.cra.sluice.application.port.ChunkSink;
import ca.gc.cra.sluice.application.port.SessionScheduler;
import ca.gc.cra.sluice.application.port.SinkListener;
import ca.gc.cra.sluice.application.port.WritableResource;
import ca.gc.cra.sluice.application.session.BufferLedger;
import ca.gc.cra.sluice.domain.transfer.AcceptResult;
import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.Watermarks;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Terminal sink buffering chunks in front of a {@link WritableResource}.
 * <p><strong>Why:</strong> Models a consumer slower than its producer: writes are deferred to scheduler tasks,
 * so buffered bytes accumulate and saturation becomes observable.</p>
 * <p><strong>Role:</strong> Last component of every session.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Commit each accepted chunk, then report saturation (write-then-signal).</li>
 *   <li>Write one whole chunk per task so output never holds half a chunk.</li>
 *   <li>Signal drained once per saturation period.</li>
 *   <li>Close the resource exactly once on finish, failure, or abort.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public final class ResourceChunkSink implements ChunkSink {
  private static final Logger log = LoggerFactory.getLogger(ResourceChunkSink.class);

  private enum State { IDLE, OPEN, FINISHING, FINISHED, FAILED, ABORTED }

  private final String name;
  private final WritableResource resource;
  private final SessionScheduler scheduler;
  private final BufferGauge gauge;
  private final ArrayDeque<Chunk> pending = new ArrayDeque<>();
  private final AtomicBoolean released = new AtomicBoolean();

  private SinkListener listener;
  private State state = State.IDLE;
  private boolean writeScheduled;
  private long bytesWritten;

  /**
   * Creates a sink.
   *
   * @param name component name used in errors and logs
   * @param resource resource to write; ownership passes to this sink
   * @param watermarks saturation thresholds
   * @param scheduler session scheduler driving writes
   * @param ledger session-wide buffered-byte tally
   */
  public ResourceChunkSink(
      String name,
      WritableResource resource,
      Watermarks watermarks,
      SessionScheduler scheduler,
      BufferLedger ledger) {
    this.name = Objects.requireNonNull(name, "name");
    this.resource = Objects.requireNonNull(resource, "resource");
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
    if (state != State.IDLE) {
      throw new IllegalStateException(name + " already started");
    }
    this.listener = listener;
    state = State.OPEN;
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
    pending.addLast(chunk);
    boolean saturated = gauge.add(chunk.length());
    scheduleWrite();
    return AcceptResult.of(saturated);
  }

  @Override
  public void finish() {
    if (state != State.OPEN) {
      return;
    }
    state = State.FINISHING;
    log.debug("{} finishing with {} bytes buffered", name, gauge.buffered());
    scheduleWrite();
  }

  @Override
  public void abort(TransferException cause) {
    Objects.requireNonNull(cause, "cause");
    if (state == State.FINISHED || state == State.FAILED || state == State.ABORTED) {
      return;
    }
    state = State.ABORTED;
    log.debug("{} aborted with {} bytes unflushed: {}", name, gauge.buffered(), cause.getMessage());
    discardPending();
    releaseQuietly();
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
    return bytesWritten;
  }

  private void scheduleWrite() {
    if (!writeScheduled) {
      writeScheduled = true;
      scheduler.execute(this::writeNext);
    }
  }

  private void writeNext() {
    writeScheduled = false;
    if (state != State.OPEN && state != State.FINISHING) {
      return;
    }
    Chunk chunk = pending.pollFirst();
    if (chunk == null) {
      if (state == State.FINISHING) {
        complete();
      }
      return;
    }
    try {
      ByteBuffer bytes = chunk.asReadOnlyBuffer();
      resource.write(bytes);
    } catch (IOException ex) {
      gauge.release(chunk.length());
      fail(TransferException.sinkWrite(name, ex));
      return;
    }
    bytesWritten += chunk.length();
    if (gauge.release(chunk.length())) {
      log.trace("{} drained at {} bytes written", name, bytesWritten);
      listener.onDrained();
    }
    if (!pending.isEmpty() || state == State.FINISHING) {
      scheduleWrite();
    }
  }

  private void complete() {
    try {
      resource.flush();
      release();
    } catch (IOException ex) {
      fail(TransferException.sinkWrite(name, ex));
      return;
    }
    state = State.FINISHED;
    log.debug("{} finished after {} bytes", name, bytesWritten);
    listener.onFinished();
  }

  private void fail(TransferException error) {
    state = State.FAILED;
    log.debug("{} failed after {} bytes: {}", name, bytesWritten, error.getMessage());
    discardPending();
    releaseQuietly();
    listener.onError(error);
  }

  private void discardPending() {
    pending.clear();
    gauge.clear();
  }

  private void release() throws IOException {
    if (released.compareAndSet(false, true)) {
      resource.close();
    }
  }

  private void releaseQuietly() {
    try {
      release();
    } catch (IOException ex) {
      log.warn("{} failed to release its resource", name, ex);
    }
  }
}
