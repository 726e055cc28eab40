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

class MainTest {
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
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: sluice"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("transfer"));
    assertTrue(buffer.toString().contains("generate"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void dispatchesGenerateThenTransfer() throws IOException {
    Path input = tempDir.resolve("large.txt");
    Path output = tempDir.resolve("output.txt");

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"generate", "out=" + input, "sizeBytes=70000"}));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"transfer", "in=" + input, "out=" + output}));

    assertEquals(70000, Files.size(output));
  }
}
