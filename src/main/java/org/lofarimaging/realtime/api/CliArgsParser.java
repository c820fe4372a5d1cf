package org.lofarimaging.realtime.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.lofarimaging.realtime.validation.Strings;

/**
 * Reads {@code key=value} arguments such as {@code station=CS002} or {@code --threads=8}. Leading dashes are
 * optional, and an empty value ({@code caltableDir=}) clears a YAML setting.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern ARGUMENT = Pattern.compile("^-{0,2}([A-Za-z][A-Za-z0-9._-]*)=(.*)$", Pattern.DOTALL);

  private CliArgsParser() {}

  /**
   * Parses every argument; the value is everything after the first {@code '='}.
   *
   * @param args positional arguments; {@code null} gives an empty map
   * @return mutable map in argument order; a repeated key keeps its last value
   * @throws IllegalArgumentException for a token that is not {@code key=value}, or a value with control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      Matcher matcher = ARGUMENT.matcher(raw.trim());
      if (!matcher.matches()) {
        throw new IllegalArgumentException(
            "expected key=value but got '" + raw.trim() + "'; see --help for the accepted keys");
      }
      String key = matcher.group(1);
      String value = matcher.group(2).trim();
      settings.put(key, value.isEmpty() ? value : Strings.requireNonBlank(key, value));
    }
    return settings;
  }
}
