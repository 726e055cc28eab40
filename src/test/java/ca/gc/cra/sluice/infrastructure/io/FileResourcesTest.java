package ca.gc.cra.sluice.infrastructure.io;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.sluice.application.port.ReadableResource;
import ca.gc.cra.sluice.application.port.WritableResource;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileResourcesTest {
  @TempDir Path tempDir;

  @Test
  void readableFillsBufferUntilEndOfFile() throws IOException {
    Path input = tempDir.resolve("in.txt");
    Files.write(input, "abcdefg".getBytes(StandardCharsets.US_ASCII));

    try (FileReadableResource readable = FileReadableResource.open(input)) {
      ByteBuffer buffer = ByteBuffer.allocate(4);
      assertEquals(4, readable.readNext(buffer));
      buffer.clear();
      assertEquals(3, readable.readNext(buffer));
      buffer.clear();
      assertEquals(-1, readable.readNext(buffer));
    }
  }

  @Test
  void writableTruncatesExistingContentAndCreatesParents() throws IOException {
    Path output = tempDir.resolve("nested/dir/out.txt");
    Files.createDirectories(output.getParent());
    Files.write(output, "stale content".getBytes(StandardCharsets.US_ASCII));

    try (FileWritableResource writable = FileWritableResource.open(output)) {
      writable.write(ByteBuffer.wrap("new".getBytes(StandardCharsets.US_ASCII)));
      writable.flush();
    }

    assertArrayEquals("new".getBytes(StandardCharsets.US_ASCII), Files.readAllBytes(output));
  }

  @Test
  void providerOpensBothEnds() throws IOException {
    Path input = tempDir.resolve("in.bin");
    Path output = tempDir.resolve("out/out.bin");
    Files.write(input, new byte[] {1, 2, 3});
    FileResourceProvider provider = new FileResourceProvider(input, output);

    try (ReadableResource readable = provider.openReadable();
        WritableResource writable = provider.openWritable()) {
      ByteBuffer buffer = ByteBuffer.allocate(8);
      readable.readNext(buffer);
      buffer.flip();
      writable.write(buffer);
    }

    assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(output));
  }

  @Test
  void missingInputFailsToOpen() {
    assertThrows(NoSuchFileException.class, () -> FileReadableResource.open(tempDir.resolve("absent")));
  }
}
