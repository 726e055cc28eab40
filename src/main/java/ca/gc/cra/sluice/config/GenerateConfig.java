package ca.gc.cra.sluice.config;

import ca.gc.cra.sluice.validation.Numbers;
import ca.gc.cra.sluice.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code generate} command.
 *
 * @param output file to create
 * @param sizeBytes total bytes to write
 * @param chunkBytes bytes per write call
 * @since 0.1.0
 */
public record GenerateConfig(Path output, long sizeBytes, int chunkBytes) {
  static final long DEFAULT_SIZE_BYTES = 100L * 1024 * 1024;
  static final int DEFAULT_CHUNK_BYTES = 1024 * 1024;
  static final long MAX_SIZE_BYTES = 64L * 1024 * 1024 * 1024;

  public GenerateConfig {
    Objects.requireNonNull(output, "output");
    Numbers.requireRange("sizeBytes", sizeBytes, 0, MAX_SIZE_BYTES);
    Numbers.requireRange("chunkBytes", chunkBytes, 1, TransferConfig.MAX_CHUNK_BYTES);
  }

  public static GenerateConfig defaults() {
    return new GenerateConfig(Path.of("large.txt"), DEFAULT_SIZE_BYTES, DEFAULT_CHUNK_BYTES);
  }

  /**
   * Builds a configuration from a flat key/value map.
   *
   * @param options merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when values are malformed or out of range
   */
  public static GenerateConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    GenerateConfig defaults = defaults();
    Path output = defaults.output();
    String rawOut = options.get("out");
    if (rawOut != null && !rawOut.isBlank()) {
      try {
        output = Path.of(Strings.requireNonBlank("out", rawOut));
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("out is not a valid path: " + rawOut, ex);
      }
    }
    long size = Numbers.parseLong("sizeBytes", options.get("sizeBytes"), defaults.sizeBytes(), 0, MAX_SIZE_BYTES);
    int chunk = Numbers.parseInt(
        "chunkBytes", options.get("chunkBytes"), defaults.chunkBytes(), 1, TransferConfig.MAX_CHUNK_BYTES);
    return new GenerateConfig(output, size, chunk);
  }
}
