package org.lofarimaging.realtime.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.lofarimaging.realtime.config.ConfigMerger;
import org.lofarimaging.realtime.config.DefaultsForMode;
import org.lofarimaging.realtime.config.YamlConfigLoader;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI arguments with the YAML and default configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }

  /**
   * Merges defaults, the optional {@code config=} YAML file and the CLI arguments for one mode.
   *
   * @param mode CLI mode
   * @param cliArgs parsed CLI arguments; {@code config} is consumed
   * @param log logger receiving override warnings
   * @return mutable effective configuration
   * @throws IllegalArgumentException if the YAML file is missing or invalid, or a cross-key rule fails
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliArgs, Logger log)
      throws IOException {
    Map<String, String> cli = new LinkedHashMap<>(cliArgs);
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} keys for {} from {}", yaml.map(Map::size).orElse(0), mode, yamlPath);
    }
    return new LinkedHashMap<>(
        ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn));
  }
}
