package ca.gc.cra.sluice.application.port;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * <strong>What:</strong> Writable byte resource supplied to a chunk sink.
 * <p><strong>Role:</strong> Port implemented by {@code FileWritableResource} and test doubles.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used from the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public interface WritableResource extends AutoCloseable {
  /**
   * Writes all remaining bytes of {@code bytes}.
   *
   * @param bytes data to write; fully consumed on success
   * @throws IOException if the resource is unwritable (e.g., disk full)
   */
  void write(ByteBuffer bytes) throws IOException;

  /**
   * Forces buffered bytes to the underlying medium.
   *
   * @throws IOException if flushing fails
   */
  default void flush() throws IOException {}

  /**
   * Releases the resource.
   *
   * @throws IOException if release fails
   */
  @Override
  void close() throws IOException;
}
