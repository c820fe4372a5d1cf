package org.lofarimaging.realtime.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void observeDefaultsRoundTripThroughConfig() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("observe");

    assertEquals("otlp", defaults.get("metricsExporter"));
    assertEquals("", defaults.get("queueCapacity"));
    assertEquals("0", defaults.get("durationSec"));
    assertEquals("false", defaults.get("dryRun"));
    assertEquals("none", defaults.get("renderer"));

    ObservationConfig config = ObservationConfig.fromMap(defaults);
    assertEquals(ObservationConfig.defaults(), config);
  }

  @Test
  void historyDefaultsPointAtImagesRoot() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("HISTORY");

    assertEquals("20", defaults.get("limit"));
    assertTrue(defaults.get("out").endsWith("images"));
  }

  @Test
  void simulateDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("simulate");

    assertEquals("LV614", defaults.get("station"));
    assertEquals("1000", defaults.get("intervalMillis"));
    assertFalse(defaults.containsKey("threads"));
  }

  @Test
  void analyzeCarriesCommonDefaultsOnly() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("analyze");

    assertEquals(4, defaults.size());
    assertEquals("false", defaults.get("verbose"));
  }

  @Test
  void unknownModeThrows() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
