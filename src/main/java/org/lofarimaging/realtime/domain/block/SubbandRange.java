package org.lofarimaging.realtime.domain.block;

import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive subband range {@code [min, max]} the station cycles through during one observation.
 *
 * @param min first subband, inclusive
 * @param max last subband, inclusive
 * @since 0.1.0
 */
public record SubbandRange(int min, int max) {
  public SubbandRange {
    if (min < 0) {
      throw new IllegalArgumentException("min subband must be non-negative (was " + min + ")");
    }
    if (max < min) {
      throw new IllegalArgumentException("max subband " + max + " is below min subband " + min);
    }
  }

  /**
   * Parses a {@code min:max} expression. Surrounding quotes are ignored and the bounds are the minimum and
   * maximum of the listed numbers, so {@code "300:100"} and {@code 100:300} describe the same range.
   *
   * @param text range expression such as {@code 100:102}
   * @return parsed range
   * @throws IllegalArgumentException if the text holds no parsable subband
   */
  public static SubbandRange parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("subband range must not be null");
    }
    String cleaned = text.strip().replace("\"", "").replace("'", "");
    List<Integer> values = new ArrayList<>();
    for (String token : cleaned.split(":")) {
      String trimmed = token.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      try {
        values.add(Integer.parseInt(trimmed));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("invalid subband value '" + trimmed + "' in range '" + text + "'", ex);
      }
    }
    if (values.isEmpty()) {
      throw new IllegalArgumentException("no subbands in range '" + text + "'");
    }
    int lo = values.get(0);
    int hi = values.get(0);
    for (int value : values) {
      lo = Math.min(lo, value);
      hi = Math.max(hi, value);
    }
    return new SubbandRange(lo, hi);
  }

  /** Number of subbands in one full cycle. */
  public int width() {
    return max - min + 1;
  }

  public boolean contains(int subband) {
    return subband >= min && subband <= max;
  }

  @Override
  public String toString() {
    return min + ":" + max;
  }
}
