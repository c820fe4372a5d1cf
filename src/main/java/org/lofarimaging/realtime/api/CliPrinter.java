package org.lofarimaging.realtime.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Console output for usage text, dry-run plans and report tables.
 *
 * <p>Writes to the stdout file descriptor so report output stays separate from the logging configuration, which
 * sends log lines to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  public static void printLines(Iterable<String> lines) {
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    printLines(Arrays.asList(lines));
  }

  /**
   * Prints a heading followed by one {@code " label : value"} row per entry, labels padded to the longest one.
   * Rows keep the map's iteration order.
   *
   * @param heading first line; skipped when {@code null}
   * @param rows labels and values
   * @param footer last line; skipped when {@code null}
   */
  public static void printSection(String heading, Map<String, ?> rows, String footer) {
    int width = 0;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    PrintWriter writer = writer();
    if (heading != null) {
      writer.println(heading);
    }
    for (Map.Entry<String, ?> row : rows.entrySet()) {
      StringBuilder line = new StringBuilder(" ").append(row.getKey());
      while (line.length() < width + 1) {
        line.append(' ');
      }
      writer.println(line.append(" : ").append(row.getValue()));
    }
    if (footer != null) {
      writer.println(footer);
    }
  }

  /** Starts an ordered row map for {@link #printSection}. */
  static Map<String, Object> rows() {
    return new LinkedHashMap<>();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
