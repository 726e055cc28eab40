package ca.gc.cra.sluice.config;

import ca.gc.cra.sluice.domain.transfer.TransferMode;
import ca.gc.cra.sluice.domain.transfer.Watermarks;
import ca.gc.cra.sluice.validation.Numbers;
import ca.gc.cra.sluice.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for the {@code transfer} command.
 * <p><strong>Role:</strong> Built from the merged defaults/YAML/CLI map and consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input file the source reads
 * @param output file the sink writes; {@code compare} mode derives two siblings from it
 * @param mode bridge strategy
 * @param chunkBytes maximum bytes per chunk read from the input
 * @param watermarks saturation thresholds applied to every buffering component
 * @param latencyEnabled whether a latency stage sits between source and sink
 * @param latencyMs delay applied by the latency stage to every chunk
 * @since 0.1.0
 */
public record TransferConfig(
    Path input,
    Path output,
    TransferMode mode,
    int chunkBytes,
    Watermarks watermarks,
    boolean latencyEnabled,
    long latencyMs) {

  static final int DEFAULT_CHUNK_BYTES = 64 * 1024;
  static final long DEFAULT_HIGH_WATER_BYTES = 64 * 1024;
  static final long DEFAULT_LATENCY_MS = 10;
  static final int MAX_CHUNK_BYTES = 64 * 1024 * 1024;
  static final long MAX_HIGH_WATER_BYTES = 1024L * 1024 * 1024;
  static final long MAX_LATENCY_MS = 60_000;

  public TransferConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(watermarks, "watermarks");
    Numbers.requireRange("chunkBytes", chunkBytes, 1, MAX_CHUNK_BYTES);
    Numbers.requireRange("latencyMs", latencyMs, 0, MAX_LATENCY_MS);
    if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
      throw new IllegalArgumentException("in and out must be different files");
    }
  }

  /**
   * Defaults matching {@link Defaults#asFlatMap(String)} for {@code transfer}.
   *
   * @return default configuration
   */
  public static TransferConfig defaults() {
    return new TransferConfig(
        Path.of("large.txt"),
        Path.of("output.txt"),
        TransferMode.PIPELINE,
        DEFAULT_CHUNK_BYTES,
        Watermarks.single(DEFAULT_HIGH_WATER_BYTES),
        false,
        DEFAULT_LATENCY_MS);
  }

  /**
   * Builds a configuration from a flat key/value map; missing keys take their defaults.
   *
   * @param options merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when values are malformed or out of range
   */
  public static TransferConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    TransferConfig defaults = defaults();

    Path input = parsePath("in", options.get("in"), defaults.input());
    Path output = parsePath("out", options.get("out"), defaults.output());
    TransferMode mode = TransferMode.fromString(options.get("mode"));
    int chunkBytes = Numbers.parseInt(
        "chunkBytes", options.get("chunkBytes"), defaults.chunkBytes(), 1, MAX_CHUNK_BYTES);
    long high = Numbers.parseLong(
        "highWaterBytes",
        options.get("highWaterBytes"),
        defaults.watermarks().highWaterBytes(),
        1,
        MAX_HIGH_WATER_BYTES);
    long low = Numbers.parseLong("lowWaterBytes", options.get("lowWaterBytes"), high, 0, MAX_HIGH_WATER_BYTES);
    if (low > high) {
      throw new IllegalArgumentException(
          "lowWaterBytes must not exceed highWaterBytes (" + low + " > " + high + ")");
    }
    boolean latencyEnabled = parseBoolean(options.get("latencyEnabled"), defaults.latencyEnabled());
    long latencyMs = Numbers.parseLong(
        "latencyMs", options.get("latencyMs"), defaults.latencyMs(), 0, MAX_LATENCY_MS);

    return new TransferConfig(
        input, output, mode, chunkBytes, new Watermarks(high, low), latencyEnabled, latencyMs);
  }

  /**
   * Output file used by one leg of {@code compare} mode.
   *
   * @param leg {@link TransferMode#MANUAL} or {@link TransferMode#PIPELINE}
   * @return {@code <out>.manual} or {@code <out>.pipeline}
   */
  public Path outputFor(TransferMode leg) {
    if (mode != TransferMode.COMPARE) {
      return output;
    }
    String suffix = leg == TransferMode.MANUAL ? ".manual" : ".pipeline";
    return output.resolveSibling(output.getFileName() + suffix);
  }

  private static Path parsePath(String name, String raw, Path fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Path.of(Strings.requireNonBlank(name, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
