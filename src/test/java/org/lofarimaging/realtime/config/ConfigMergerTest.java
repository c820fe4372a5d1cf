package org.lofarimaging.realtime.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("threads", "4", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("threads", "8", "step", "2");
    Map<String, String> cli = Map.of("threads", "2", "step", "5");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "observe",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("2", merged.get("threads"));
    assertEquals("5", merged.get("step"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI value for threads overrides YAML (8 -> 2)"));
    assertTrue(warnings.contains("CLI value for step overrides YAML (2 -> 5)"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "observe",
        Optional.of(Map.of("station", "CS002")),
        Map.of(),
        Map.of("station", "LV614"),
        warnings::add);

    assertEquals("CS002", merged.get("station"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void nullCliValuesAreSkipped() {
    Map<String, String> cli = new HashMap<>();
    cli.put("threads", null);

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "observe", Optional.empty(), cli, Map.of("threads", "4"), msg -> {});

    assertEquals("4", merged.get("threads"));
  }

  @Test
  void manualSubbandsRequireBounds() {
    Map<String, String> defaults = Map.of("manualSubbands", "false", "minSubband", "", "maxSubband", "");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "observe",
            Optional.of(Map.of("manualSubbands", "true", "minSubband", "100")),
            Map.of(),
            defaults,
            msg -> {}));
  }

  @Test
  void processRendererRequiresCommand() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "observe",
            Optional.empty(),
            Map.of("renderer", "PROCESS"),
            Map.of("rendererCommand", ""),
            msg -> {}));
  }

  @Test
  void crossKeyRulesApplyOnlyToObserve() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "simulate",
        Optional.empty(),
        Map.of("manualSubbands", "true"),
        Map.of(),
        msg -> {});

    assertEquals("true", merged.get("manualSubbands"));
  }

  @Test
  void repeatingTheYamlValueOnTheCliIsNotWarned() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "observe", Optional.of(Map.of("station", "CS002")), Map.of("station", "CS002"), Map.of(), warnings::add);

    assertTrue(warnings.isEmpty());
  }

  @Test
  void simulateRejectsReplayOntoItsSource() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "simulate",
            Optional.empty(),
            Map.of("source", "/data/rec_xst.dat", "target", "/data/rec_xst.dat"),
            Map.of(),
            msg -> {}));
  }

  @Test
  void resultIsImmutable() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "history", Optional.empty(), Map.of(), Map.of("limit", "20"), null);

    assertFalse(merged.isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> merged.put("limit", "1"));
  }
}
