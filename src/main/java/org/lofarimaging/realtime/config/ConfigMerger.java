package org.lofarimaging.realtime.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Layers CLI arguments over YAML settings over {@link DefaultsForMode}, then checks the rules that span more than
 * one key. Single-key validation (ranges, paths) stays with the typed config records.
 */
public final class ConfigMerger {

  private static final Map<String, List<CrossKeyRule>> RULES = Map.of(
      "observe", List.of(
          new CrossKeyRule(
              "manualSubbands=true requires minSubband and maxSubband",
              cfg -> isTrue(cfg.get("manualSubbands"))
                  && (isBlank(cfg.get("minSubband")) || isBlank(cfg.get("maxSubband")))),
          new CrossKeyRule(
              "renderer=process requires rendererCommand",
              cfg -> "process".equals(normalized(cfg.get("renderer"))) && isBlank(cfg.get("rendererCommand")))),
      "simulate", List.of(
          new CrossKeyRule(
              "source and target must be different files",
              cfg -> !isBlank(cfg.get("source"))
                  && cfg.get("source").trim().equals(String.valueOf(cfg.get("target")).trim()))));

  private ConfigMerger() {}

  /**
   * Builds the effective settings of one mode.
   *
   * @param mode CLI mode; selects the cross-key rules
   * @param yaml settings from the {@code common} and mode sections of the YAML file, if one was given
   * @param cli {@code key=value} arguments; {@code null} values are ignored
   * @param defaults defaults of the mode
   * @param warn receives one message per YAML value replaced by a different CLI value; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException if a cross-key rule is broken
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> fromYaml = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>();
    if (defaults != null) {
      merged.putAll(defaults);
    }
    merged.putAll(fromYaml);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        String replaced = fromYaml.get(key);
        if (replaced != null && !replaced.equals(value) && warn != null) {
          warn.accept("CLI value for " + key + " overrides YAML (" + replaced + " -> " + value + ")");
        }
        merged.put(key, value);
      });
    }
    for (CrossKeyRule rule : RULES.getOrDefault(normalized(mode), List.of())) {
      if (rule.violatedBy().test(merged)) {
        throw new IllegalArgumentException(rule.message());
      }
    }
    return Map.copyOf(merged);
  }

  private static boolean isTrue(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String normalized(String value) {
    return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
  }

  private record CrossKeyRule(String message, Predicate<Map<String, String>> violatedBy) {}
}
