package ca.gc.cra.sluice.infrastructure.io;

import ca.gc.cra.sluice.application.port.ReadableResource;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link ReadableResource} over a {@link FileChannel}; each call fills the target buffer unless the file ends.
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FileReadableResource implements ReadableResource {
  private final Path path;
  private final FileChannel channel;

  private FileReadableResource(Path path, FileChannel channel) {
    this.path = path;
    this.channel = channel;
  }

  /**
   * Opens {@code path} for reading.
   *
   * @param path file to read
   * @return open resource
   * @throws IOException if the file cannot be opened
   */
  public static FileReadableResource open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    return new FileReadableResource(path, FileChannel.open(path, StandardOpenOption.READ));
  }

  @Override
  public int readNext(ByteBuffer target) throws IOException {
    int total = 0;
    while (target.hasRemaining()) {
      int read = channel.read(target);
      if (read < 0) {
        return total == 0 ? -1 : total;
      }
      total += read;
    }
    return total;
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
