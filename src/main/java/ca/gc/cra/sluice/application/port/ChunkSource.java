package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import java.util.Optional;

/**
 * <strong>What:</strong> Producer of an ordered chunk sequence from an underlying readable resource.
 * <p><strong>Why:</strong> Decouples the bridges from file handles and read sizing.</p>
 * <p><strong>Role:</strong> Head of every transfer session.</p>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public interface ChunkSource extends ChunkEmitter {
  /**
   * Reads the next chunk directly, bypassing the listener.
   *
   * @return next chunk, or empty at end of stream (the resource is released by then)
   * @throws TransferException with kind {@code SOURCE_READ} if the resource fails, or
   *     {@code PROTOCOL_VIOLATION} after the source was aborted
   */
  Optional<Chunk> produce() throws TransferException;

  /**
   * Total bytes produced so far.
   *
   * @return byte count
   */
  long bytesProduced();
}
