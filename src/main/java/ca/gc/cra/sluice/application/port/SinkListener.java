package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.domain.transfer.TransferException;

/**
 * Receives capacity and lifecycle notifications from a {@link ChunkSink}.
 *
 * @since 0.1.0
 */
public interface SinkListener {
  /** A saturated sink fell to or below its low-water mark. */
  void onDrained();

  /** All buffered chunks were delivered after {@link ChunkSink#finish()}. */
  void onFinished();

  /**
   * The sink failed; unflushed chunks were discarded and resources released.
   *
   * @param error failure description
   */
  void onError(TransferException error);
}
