package ca.gc.cra.sluice.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    Map<String, String> defaults = Map.of("chunkBytes", "65536", "mode", "pipeline", "latencyMs", "10");
    Map<String, String> yaml = Map.of("chunkBytes", "4096", "mode", "manual");
    Map<String, String> cli = Map.of("mode", "compare");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("4096", merged.get("chunkBytes"));
    assertEquals("compare", merged.get("mode"));
    assertEquals("10", merged.get("latencyMs"));
    assertEquals(List.of("CLI overrides YAML for key: mode"), warnings);
  }

  @Test
  void worksWithoutYaml() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("in", "a.txt"), Map.of("in", "large.txt", "out", "output.txt"), null);

    assertEquals(Map.of("in", "a.txt", "out", "output.txt"), merged);
  }
}
