package ca.gc.cra.sluice.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each sluice command.
 * <p>The lowest-precedence layer of {@link ConfigMerger}; YAML and CLI values override it.</p>
 */
public final class Defaults {
  private static final Map<String, String> COMMON = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "verbose", "false");

  private Defaults() {}

  /**
   * Returns the defaults for {@code command} merged over the common defaults.
   *
   * @param command {@code transfer} or {@code generate}
   * @return unmodifiable flat map
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON);
    defaults.putAll(switch (command.trim().toLowerCase(Locale.ROOT)) {
      case "transfer" -> transfer();
      case "generate" -> generate();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> transfer() {
    TransferConfig defaults = TransferConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", defaults.input().toString());
    map.put("out", defaults.output().toString());
    map.put("mode", defaults.mode().name().toLowerCase(Locale.ROOT));
    map.put("chunkBytes", Integer.toString(defaults.chunkBytes()));
    map.put("highWaterBytes", Long.toString(defaults.watermarks().highWaterBytes()));
    // lowWaterBytes stays unset so it follows highWaterBytes
    map.put("latencyEnabled", Boolean.toString(defaults.latencyEnabled()));
    map.put("latencyMs", Long.toString(defaults.latencyMs()));
    return map;
  }

  private static Map<String, String> generate() {
    GenerateConfig defaults = GenerateConfig.defaults();
    return Map.of(
        "out", defaults.output().toString(),
        "sizeBytes", Long.toString(defaults.sizeBytes()),
        "chunkBytes", Integer.toString(defaults.chunkBytes()));
  }
}
