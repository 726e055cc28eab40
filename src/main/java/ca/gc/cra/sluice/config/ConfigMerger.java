package ca.gc.cra.sluice.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides; may be {@code null}
   * @param defaults embedded defaults for the command; may be {@code null}
   * @param warn invoked when a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged map
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    return Map.copyOf(merged);
  }
}
