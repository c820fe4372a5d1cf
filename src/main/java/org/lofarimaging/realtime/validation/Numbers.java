package org.lofarimaging.realtime.validation;

/**
 * <strong>What:</strong> Numeric range checks for configuration values.
 * <p><strong>Why:</strong> Thread counts, decimation steps, subband bounds and station geometry must be
 * validated before the render pool or the observation directory is created.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in the message; {@code "value"} when blank
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a finite value falls within an inclusive range.
   *
   * @param name parameter name used in the message
   * @param value candidate value, e.g. a height in metres
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} is NaN, infinite or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
