package org.lofarimaging.realtime.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the station's YAML settings file.
 *
 * <p>Top-level sections are {@code common} and one per command ({@code observe}, {@code history},
 * {@code analyze}, {@code simulate}); section names are case-insensitive and anything else is rejected so a
 * misspelt section does not silently fall back to defaults. Nested mappings become dotted keys. A list is
 * joined with single spaces, which lets {@code rendererCommand} be written as {@code [python3, imager.py]}.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  private static final Set<String> SECTIONS = Set.of(COMMON_SECTION, "observe", "history", "analyze", "simulate");

  private YamlConfigLoader() {}

  /**
   * Loads {@code common} and then the section of {@code mode} on top of it.
   *
   * @param path YAML file
   * @param mode command whose section applies
   * @return flattened settings, or empty when {@code path} does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML does not parse or is not laid out in sections
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Map<String, Map<?, ?>> sections = readSections(path);
    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : List.of(COMMON_SECTION, mode.trim().toLowerCase(Locale.ROOT))) {
      Map<?, ?> section = sections.get(name);
      if (section != null) {
        flattenInto(settings, name, "", section);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Map<?, ?>> readSections(Path path) throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    Map<String, Map<?, ?>> sections = new LinkedHashMap<>();
    if (document == null) {
      return sections;
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + " must be a mapping of sections " + SECTIONS);
    }
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(name)) {
        throw new IllegalArgumentException("Unknown section '" + entry.getKey() + "' in " + path
            + "; expected one of " + SECTIONS);
      }
      if (entry.getValue() == null) {
        continue;
      }
      if (!(entry.getValue() instanceof Map<?, ?> body)) {
        throw new IllegalArgumentException("Section " + name + " in " + path + " must be a mapping");
      }
      sections.put(name, body);
    }
    return sections;
  }

  private static void flattenInto(Map<String, String> target, String section, String prefix, Map<?, ?> node) {
    for (Map.Entry<?, ?> entry : node.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("Section " + section + " has a key that is not a name: " + entry.getKey());
      }
      String key = prefix + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flattenInto(target, section, key + '.', nested);
      } else if (value instanceof List<?> items) {
        target.put(key, joinWords(key, items));
      } else {
        target.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static String joinWords(String key, List<?> items) {
    List<String> words = new ArrayList<>(items.size());
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException("List " + key + " must hold plain values");
      }
      String word = item.toString();
      if (word.isBlank() || word.chars().anyMatch(Character::isWhitespace)) {
        throw new IllegalArgumentException("List " + key + " item '" + word + "' must be a single word");
      }
      words.add(word);
    }
    return String.join(" ", words);
  }
}
