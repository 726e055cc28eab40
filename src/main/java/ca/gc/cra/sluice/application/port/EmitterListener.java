package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.TransferException;

/**
 * Receives output from a {@link ChunkEmitter}.
 *
 * <p>Exactly one of {@link #onEnd()} or {@link #onError(TransferException)} is delivered, after which no
 * further callback arrives.</p>
 *
 * @since 0.1.0
 */
public interface EmitterListener {
  /**
   * Next chunk in stream order.
   *
   * @param chunk chunk handed off by value
   */
  void onChunk(Chunk chunk);

  /** All bytes were emitted and the emitter released its resources. */
  void onEnd();

  /**
   * The emitter failed; its resources were released before this call.
   *
   * @param error failure description
   */
  void onError(TransferException error);
}
