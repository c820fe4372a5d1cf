package org.lofarimaging.realtime.logging;

import java.nio.charset.StandardCharsets;

/**
 * Helpers that keep log lines and exception messages short.
 *
 * <p>Renderer stderr can run to a full Python traceback and descriptor files can be large. Both end up in log
 * lines and failure messages, so callers cut them down here first. Limits are in UTF-8 bytes and cuts never split
 * a code point.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Keeps the leading {@code maxBytes} UTF-8 bytes of {@code value}.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} itself when it fits, otherwise the prefix followed by
   *     {@code "... (truncated, kept of total bytes)"}
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    requirePositive(maxBytes);
    int total = utf8Length(value);
    if (total <= maxBytes) {
      return value;
    }
    int end = prefixEnd(value, maxBytes);
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + " bytes)";
  }

  /**
   * Keeps the last {@code maxLines} non-blank lines of a process' stderr, then applies {@link #truncate}.
   * A Python imager prints the actual error at the end of its traceback, so the tail is the useful part.
   *
   * @param stderr captured stream contents; {@code null} yields {@code "<null>"}
   * @param maxLines line budget; must be positive
   * @param maxBytes byte budget for the result; must be positive
   * @return excerpt joined with {@code " | "}, or {@code "<empty>"} when nothing was printed
   */
  public static String tail(String stderr, int maxLines, int maxBytes) {
    if (stderr == null) {
      return NULL_PLACEHOLDER;
    }
    requirePositive(maxLines);
    requirePositive(maxBytes);
    String[] lines = stderr.strip().split("\\R");
    StringBuilder excerpt = new StringBuilder();
    int kept = 0;
    for (int i = lines.length - 1; i >= 0 && kept < maxLines; i--) {
      String line = lines[i].strip();
      if (line.isEmpty()) {
        continue;
      }
      if (kept > 0) {
        excerpt.insert(0, " | ");
      }
      excerpt.insert(0, line);
      kept++;
    }
    if (kept == 0) {
      return "<empty>";
    }
    return truncate(excerpt.toString(), maxBytes);
  }

  private static int prefixEnd(String value, int maxBytes) {
    int bytes = 0;
    int index = 0;
    while (index < value.length()) {
      int codePoint = value.codePointAt(index);
      int width = utf8Width(codePoint);
      if (bytes + width > maxBytes) {
        break;
      }
      bytes += width;
      index += Character.charCount(codePoint);
    }
    return index;
  }

  private static int utf8Length(String value) {
    return value.getBytes(StandardCharsets.UTF_8).length;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }

  private static void requirePositive(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
  }
}
