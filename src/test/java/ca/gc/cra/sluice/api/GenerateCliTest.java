package ca.gc.cra.sluice.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GenerateCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void writesRequestedSize() throws IOException {
    Path output = tempDir.resolve("sample.txt");

    ExitCode code = GenerateCli.run(new String[] {"out=" + output, "sizeBytes=5000", "chunkBytes=1024"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(5000, Files.size(output));
    assertTrue(buffer.toString().contains("(5000 bytes)"));
  }

  @Test
  void invalidSizeReturnsInvalidArgs() {
    ExitCode code = GenerateCli.run(new String[] {"out=" + tempDir.resolve("x"), "sizeBytes=-3"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: generate"));
  }

  @Test
  void unwritableTargetReturnsIoError() throws IOException {
    Path blocker = tempDir.resolve("file");
    Files.writeString(blocker, "not a directory");

    ExitCode code = GenerateCli.run(new String[] {"out=" + blocker.resolve("child.txt"), "sizeBytes=10"});

    assertEquals(ExitCode.IO_ERROR, code);
  }
}
