package ca.gc.cra.sluice.application.port;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * <strong>What:</strong> Readable byte resource supplied to a chunk source.
 * <p><strong>Why:</strong> Replaces raw file handles so tests can inject failures and in-memory data.</p>
 * <p><strong>Role:</strong> Port implemented by {@code FileReadableResource} and test doubles.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used from the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public interface ReadableResource extends AutoCloseable {
  /**
   * Reads up to {@code target.remaining()} bytes, filling the buffer unless the end is reached.
   *
   * @param target buffer owned by the caller
   * @return number of bytes read, or {@code -1} at end of stream
   * @throws IOException if the resource is unreadable
   */
  int readNext(ByteBuffer target) throws IOException;

  /**
   * Releases the resource.
   *
   * @throws IOException if release fails
   */
  @Override
  void close() throws IOException;
}
