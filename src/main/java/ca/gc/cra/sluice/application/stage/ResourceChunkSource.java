package ca.gc.cra.sluice.application.stage;

import ca.gc.cra.sluice.application.port.ChunkSource;
import ca.gc.cra.sluice.application.port.EmitterListener;
import ca.gc.cra.sluice.application.port.ReadableResource;
import ca.gc.cra.sluice.application.port.SessionScheduler;
import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Chunk source reading fixed-size chunks from a {@link ReadableResource}.
 * <p><strong>Why:</strong> Gives the bridges a pausable producer whose memory footprint is one read buffer.</p>
 * <p><strong>Role:</strong> Head component of every session.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read one chunk per scheduler task while flowing so sink flushes and timers interleave.</li>
 *   <li>Stop scheduling reads while suspended.</li>
 *   <li>Release the resource exactly once: at end of stream, on read failure, or on abort.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread; the release guard is atomic so a
 * stray abort from another thread still closes the resource only once.</p>
 *
 * @since 0.1.0
 */
public final class ResourceChunkSource implements ChunkSource {
  private static final Logger log = LoggerFactory.getLogger(ResourceChunkSource.class);

  private enum State { IDLE, FLOWING, SUSPENDED, ENDED, FAILED, ABORTED }

  private final String name;
  private final ReadableResource resource;
  private final SessionScheduler scheduler;
  private final ByteBuffer readBuffer;
  private final AtomicBoolean released = new AtomicBoolean();

  private EmitterListener listener;
  private State state = State.IDLE;
  private boolean readScheduled;
  private long offset;

  /**
   * Creates a source.
   *
   * @param name component name used in errors and logs
   * @param resource resource to read; ownership passes to this source
   * @param chunkBytes maximum chunk size in bytes; must be positive
   * @param scheduler session scheduler driving reads
   */
  public ResourceChunkSource(
      String name, ReadableResource resource, int chunkBytes, SessionScheduler scheduler) {
    this.name = Objects.requireNonNull(name, "name");
    this.resource = Objects.requireNonNull(resource, "resource");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be positive");
    }
    this.readBuffer = ByteBuffer.allocate(chunkBytes);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void start(EmitterListener listener) {
    Objects.requireNonNull(listener, "listener");
    if (state != State.IDLE) {
      throw new IllegalStateException(name + " already started");
    }
    this.listener = listener;
    state = State.FLOWING;
    scheduleRead();
  }

  @Override
  public void suspend() {
    if (state == State.FLOWING) {
      state = State.SUSPENDED;
      log.trace("{} suspended at offset {}", name, offset);
    }
  }

  @Override
  public void resume() {
    if (state == State.SUSPENDED) {
      state = State.FLOWING;
      log.trace("{} resumed at offset {}", name, offset);
      scheduleRead();
    }
  }

  @Override
  public boolean isSuspended() {
    return state == State.SUSPENDED;
  }

  @Override
  public Optional<Chunk> produce() throws TransferException {
    if (state == State.ABORTED || state == State.FAILED) {
      throw TransferException.protocolViolation(name, "produce after " + state);
    }
    if (state == State.ENDED) {
      return Optional.empty();
    }
    int read;
    try {
      readBuffer.clear();
      read = resource.readNext(readBuffer);
    } catch (IOException ex) {
      state = State.FAILED;
      releaseQuietly();
      throw TransferException.sourceRead(name, ex);
    }
    if (state == State.ABORTED) {
      // aborted while the read was in flight; the bytes are dropped
      return Optional.empty();
    }
    if (read < 0) {
      state = State.ENDED;
      try {
        release();
      } catch (IOException ex) {
        state = State.FAILED;
        throw TransferException.sourceRead(name, ex);
      }
      log.debug("{} reached end of stream after {} bytes", name, offset);
      return Optional.empty();
    }
    readBuffer.flip();
    Chunk chunk = Chunk.copyOf(offset, readBuffer);
    offset += chunk.length();
    return Optional.of(chunk);
  }

  @Override
  public long bytesProduced() {
    return offset;
  }

  @Override
  public void abort(TransferException cause) {
    Objects.requireNonNull(cause, "cause");
    if (state == State.ENDED || state == State.FAILED || state == State.ABORTED) {
      return;
    }
    state = State.ABORTED;
    log.debug("{} aborted at offset {}: {}", name, offset, cause.getMessage());
    releaseQuietly();
  }

  private void scheduleRead() {
    if (!readScheduled) {
      readScheduled = true;
      scheduler.execute(this::readNext);
    }
  }

  private void readNext() {
    readScheduled = false;
    if (state != State.FLOWING) {
      return;
    }
    Optional<Chunk> next;
    try {
      next = produce();
    } catch (TransferException ex) {
      if (state == State.FAILED) {
        listener.onError(ex);
      }
      return;
    }
    if (next.isEmpty()) {
      if (state == State.ENDED) {
        listener.onEnd();
      }
      return;
    }
    listener.onChunk(next.get());
    if (state == State.FLOWING) {
      scheduleRead();
    }
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
