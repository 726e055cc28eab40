package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.config.ConfigMerger;
import ca.gc.cra.sluice.config.Defaults;
import ca.gc.cra.sluice.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps of the commands: pull {@code config=FILE} out of the arguments and merge the layers.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Merges defaults, the optional YAML file and CLI values for {@code command}.
   *
   * @param command {@code transfer} or {@code generate}
   * @param cli CLI key/value arguments; {@code config} is consumed
   * @param log logger receiving override warnings
   * @return effective configuration map
   * @throws ConfigFileException when the YAML file is missing, unreadable or malformed
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> cli, Logger log)
      throws ConfigFileException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new ConfigFileException("Configuration file does not exist: " + yamlPath, null);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, command);
      } catch (IllegalArgumentException | IOException ex) {
        throw new ConfigFileException("Invalid configuration file " + yamlPath + ": " + ex.getMessage(), ex);
      }
    }
    return ConfigMerger.buildEffectiveConfig(yaml, cli, Defaults.asFlatMap(command), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  /** The YAML layer could not be used. */
  static final class ConfigFileException extends Exception {
    private static final long serialVersionUID = 1L;

    ConfigFileException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
