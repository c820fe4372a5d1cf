package org.lofarimaging.realtime.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults of {@code mode} merged over the common defaults.
   *
   * @param mode target CLI mode (observe, history, analyze, simulate)
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "observe" -> buildObserveDefaults();
      case "history" -> buildHistoryDefaults();
      case "analyze" -> Map.of();
      case "simulate" -> buildSimulateDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildObserveDefaults() {
    ObservationConfig defaults = ObservationConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("input", defaults.inputDirectory().toString());
    map.put("out", defaults.imagesRoot().toString());
    map.put("station", defaults.stationName());
    map.put("rcuMode", Integer.toString(defaults.rcuMode()));
    map.put("heightM", Double.toString(defaults.heightMetres()));
    map.put("extentM", Double.toString(defaults.extentMetres()));
    map.put("threads", Integer.toString(defaults.threads()));
    map.put("step", Integer.toString(defaults.step()));
    // blank: derived from threads
    map.put("queueCapacity", "");
    map.put("pollMillis", Long.toString(defaults.pollInterval().toMillis()));
    map.put("drainTimeoutSec", seconds(defaults.drainTimeout()));
    map.put("statusIntervalSec", seconds(defaults.statusInterval()));
    map.put("graceDelayMillis", Long.toString(defaults.graceDelay().toMillis()));
    map.put("manualSubbands", Boolean.toString(defaults.manualSubbands()));
    map.put("minSubband", "");
    map.put("maxSubband", "");
    map.put("caltableDir", "");
    map.put("renderer", defaults.renderer().name().toLowerCase(Locale.ROOT));
    map.put("rendererCommand", "");
    map.put("renderTimeoutSec", seconds(defaults.renderTimeout()));
    map.put("warmupFile", "");
    map.put("warmupSubband", Integer.toString(defaults.warmupSubband()));
    map.put("durationSec", "0");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildHistoryDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", ObservationConfig.DEFAULT_BASE.resolve("images").toString());
    map.put("limit", "20");
    return map;
  }

  private static Map<String, String> buildSimulateDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("station", "LV614");
    map.put("minSubband", "100");
    map.put("maxSubband", "100");
    map.put("intervalMillis", "1000");
    return map;
  }

  private static String seconds(Duration duration) {
    return Long.toString(duration.toSeconds());
  }
}
