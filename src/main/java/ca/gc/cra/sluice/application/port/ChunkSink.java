package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.domain.transfer.AcceptResult;
import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.TransferException;

/**
 * <strong>What:</strong> Downstream half of the capability contract: a bounded buffer in front of a consumer.
 * <p><strong>Why:</strong> Lets the bridges learn about saturation after each write and resume on drain.</p>
 * <p><strong>Role:</strong> Application port implemented by the terminal sink and by {@link ChunkStage}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Commit every accepted chunk, then report whether the high-water mark was reached.</li>
 *   <li>Emit exactly one {@link SinkListener#onDrained()} per saturation period.</li>
 *   <li>Make {@link #finish()} and {@link #abort(TransferException)} idempotent and mutually exclusive.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public interface ChunkSink {
  /**
   * Component name used in errors, logs and reports.
   *
   * @return stable, human-readable name
   */
  String name();

  /**
   * Binds the listener that receives drained, finished and error notifications.
   *
   * @param listener receiver; must not be {@code null}
   * @throws IllegalStateException if already started
   */
  void start(SinkListener listener);

  /**
   * Buffers a chunk for delivery.
   *
   * @param chunk chunk handed off by value
   * @return saturation state after the write
   * @throws TransferException with kind {@code PROTOCOL_VIOLATION} when called while saturated, before
   *     {@link #start(SinkListener)}, or after {@link #finish()} / {@link #abort(TransferException)}
   */
  AcceptResult accept(Chunk chunk) throws TransferException;

  /** Flushes buffered chunks, then reports {@link SinkListener#onFinished()}; no-op once finishing. */
  void finish();

  /**
   * Discards unflushed chunks and releases resources; no-op once terminal.
   *
   * @param cause failure that triggered the abort; must not be {@code null}
   */
  void abort(TransferException cause);

  /**
   * Bytes accepted but not yet delivered.
   *
   * @return current buffered-byte count
   */
  long bufferedBytes();

  /**
   * Highest value {@link #bufferedBytes()} reached.
   *
   * @return peak buffered-byte count
   */
  long peakBufferedBytes();

  /**
   * Bytes delivered past this component (written for a terminal sink, forwarded for a stage).
   *
   * @return delivered byte count
   */
  long bytesDelivered();
}
