package ca.gc.cra.sluice.application.port;

import java.io.IOException;

/**
 * Supplies the readable and writable resources of one transfer session.
 *
 * @since 0.1.0
 */
public interface ResourceProvider {
  /**
   * Opens the resource the source reads from.
   *
   * @return newly opened resource owned by the caller
   * @throws IOException if the resource cannot be opened
   */
  ReadableResource openReadable() throws IOException;

  /**
   * Opens the resource the sink writes to.
   *
   * @return newly opened resource owned by the caller
   * @throws IOException if the resource cannot be opened
   */
  WritableResource openWritable() throws IOException;
}
