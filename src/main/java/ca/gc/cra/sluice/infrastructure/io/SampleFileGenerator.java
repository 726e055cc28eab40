package ca.gc.cra.sluice.infrastructure.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a file of repeated {@code 'a'} bytes for transfer demonstrations.
 * <p><strong>Role:</strong> Backs the {@code generate} command.</p>
 * <p><strong>Observability:</strong> Logs progress every ten chunks at INFO.</p>
 *
 * @since 0.1.0
 */
public final class SampleFileGenerator {
  private static final Logger log = LoggerFactory.getLogger(SampleFileGenerator.class);
  private static final int LOG_EVERY_CHUNKS = 10;
  static final byte FILL = 'a';

  private final int chunkBytes;

  /**
   * Creates a generator.
   *
   * @param chunkBytes bytes written per write call; must be positive
   */
  public SampleFileGenerator(int chunkBytes) {
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be positive");
    }
    this.chunkBytes = chunkBytes;
  }

  /**
   * Writes exactly {@code sizeBytes} bytes to {@code target}, replacing any existing content.
   *
   * @param target destination file
   * @param sizeBytes file size; must not be negative
   * @return bytes written
   * @throws IOException if writing fails
   */
  public long generate(Path target, long sizeBytes) throws IOException {
    Objects.requireNonNull(target, "target");
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must not be negative");
    }
    byte[] fill = new byte[chunkBytes];
    Arrays.fill(fill, FILL);
    long written = 0;
    long chunks = 0;
    try (FileWritableResource out = FileWritableResource.open(target)) {
      while (written < sizeBytes) {
        int len = (int) Math.min(chunkBytes, sizeBytes - written);
        out.write(ByteBuffer.wrap(fill, 0, len));
        written += len;
        chunks++;
        if (chunks % LOG_EVERY_CHUNKS == 0) {
          log.info("Generated {} of {} bytes into {}", written, sizeBytes, target);
        }
      }
      out.flush();
    }
    log.info("Generated {} ({} bytes in {} chunk(s))", target, written, chunks);
    return written;
  }
}
