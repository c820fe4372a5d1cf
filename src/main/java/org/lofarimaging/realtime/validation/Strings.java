package org.lofarimaging.realtime.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String checks for CLI and YAML values.
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern STATION_PATTERN = Pattern.compile("^[A-Za-z0-9]{2,16}$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate text
   * @return the trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a LOFAR station identifier such as {@code LV614} or {@code CS002}.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate station name
   * @return the trimmed, upper-cased station name
   * @throws IllegalArgumentException if the name is not 2 to 16 ASCII letters or digits
   */
  public static String requireStationName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!STATION_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "must be 2-16 letters or digits (was " + sanitized + ")"));
    }
    return sanitized.toUpperCase(Locale.ROOT);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
