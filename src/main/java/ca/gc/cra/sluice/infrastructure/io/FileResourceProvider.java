package ca.gc.cra.sluice.infrastructure.io;

import ca.gc.cra.sluice.application.port.ReadableResource;
import ca.gc.cra.sluice.application.port.ResourceProvider;
import ca.gc.cra.sluice.application.port.WritableResource;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Opens a fixed input file and output file for each session.
 *
 * @param input file the source reads
 * @param output file the sink writes; created or truncated
 * @since 0.1.0
 */
public record FileResourceProvider(Path input, Path output) implements ResourceProvider {
  public FileResourceProvider {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
  }

  @Override
  public ReadableResource openReadable() throws IOException {
    return FileReadableResource.open(input);
  }

  @Override
  public WritableResource openWritable() throws IOException {
    return FileWritableResource.open(output);
  }
}
