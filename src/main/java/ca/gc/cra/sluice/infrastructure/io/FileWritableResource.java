package ca.gc.cra.sluice.infrastructure.io;

import ca.gc.cra.sluice.application.port.WritableResource;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link WritableResource} over a {@link FileChannel}; the file is created or truncated on open.
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FileWritableResource implements WritableResource {
  private final Path path;
  private final FileChannel channel;

  private FileWritableResource(Path path, FileChannel channel) {
    this.path = path;
    this.channel = channel;
  }

  /**
   * Opens {@code path} for writing, creating parent directories when absent.
   *
   * @param path destination file
   * @return open resource
   * @throws IOException if the file cannot be created
   */
  public static FileWritableResource open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    FileChannel channel = FileChannel.open(
        path,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
    return new FileWritableResource(path, channel);
  }

  @Override
  public void write(ByteBuffer bytes) throws IOException {
    while (bytes.hasRemaining()) {
      channel.write(bytes);
    }
  }

  @Override
  public void flush() throws IOException {
    channel.force(false);
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
