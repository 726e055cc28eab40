package ca.gc.cra.sluice.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ConfigCliUtilsTest {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtilsTest.class);

  @TempDir Path tempDir;

  @Test
  void yamlSitsBetweenDefaultsAndCli() throws Exception {
    Path yaml = tempDir.resolve("sluice.yaml");
    Files.writeString(yaml, "transfer:\n  chunkBytes: 4096\n  mode: manual\n");
    Map<String, String> cli = new LinkedHashMap<>(Map.of("config", yaml.toString(), "mode", "compare"));

    Map<String, String> effective = ConfigCliUtils.effectiveConfig("transfer", cli, log);

    assertEquals("4096", effective.get("chunkBytes"));
    assertEquals("compare", effective.get("mode"));
    assertEquals("65536", effective.get("highWaterBytes"));
    assertFalse(effective.containsKey("config"));
  }

  @Test
  void unparsableYamlIsConfigFileError() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "transfer: [oops");
    Map<String, String> cli = new LinkedHashMap<>(Map.of("config", yaml.toString()));

    ConfigCliUtils.ConfigFileException ex = assertThrows(ConfigCliUtils.ConfigFileException.class,
        () -> ConfigCliUtils.effectiveConfig("transfer", cli, log));
    assertTrue(ex.getMessage().startsWith("Invalid configuration file"));
  }

  @Test
  void parseBooleanFallsBack() {
    assertTrue(ConfigCliUtils.parseBoolean(Map.of("verbose", "TRUE"), "verbose", false));
    assertFalse(ConfigCliUtils.parseBoolean(Map.of(), "verbose", false));
    assertTrue(ConfigCliUtils.parseBoolean(null, "verbose", true));
  }
}
