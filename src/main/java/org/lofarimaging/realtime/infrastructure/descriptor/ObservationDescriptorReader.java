package org.lofarimaging.realtime.infrastructure.descriptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.lofarimaging.realtime.application.pipeline.ObservationSetupException;
import org.lofarimaging.realtime.application.port.SubbandRangeResolver;
import org.lofarimaging.realtime.domain.block.SubbandRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the subband range from the observation descriptor in the input directory.
 * <p><strong>How:</strong> After a short grace delay (the descriptor is often written just after the stream), the
 * first {@code .h} or {@code .sh} file in name order is parsed as {@code key=value} lines. The {@code subbands}
 * key, or an embedded {@code --subbands=a:b} token, gives the range as the min and max of its numbers.</p>
 * <p><strong>Fallbacks:</strong> With manual subbands enabled the configured bounds are used directly. Without a
 * descriptor or key, configured bounds are used when both are set; otherwise the observation cannot start.</p>
 *
 * @since 0.1.0
 */
public final class ObservationDescriptorReader implements SubbandRangeResolver {
  private static final Logger log = LoggerFactory.getLogger(ObservationDescriptorReader.class);

  private static final String SUBBANDS_KEY = "subbands";
  private static final String SUBBANDS_FLAG = "--subbands=";

  private final boolean manualSubbands;
  private final Integer minSubband;
  private final Integer maxSubband;
  private final Duration graceDelay;

  /**
   * Creates the reader.
   *
   * @param manualSubbands use {@code minSubband}/{@code maxSubband} without reading any descriptor
   * @param minSubband configured lower bound, or {@code null}
   * @param maxSubband configured upper bound, or {@code null}
   * @param graceDelay wait before looking for the descriptor
   */
  public ObservationDescriptorReader(
      boolean manualSubbands, Integer minSubband, Integer maxSubband, Duration graceDelay) {
    if (manualSubbands && (minSubband == null || maxSubband == null)) {
      throw new IllegalArgumentException("manual subbands require both minSubband and maxSubband");
    }
    this.manualSubbands = manualSubbands;
    this.minSubband = minSubband;
    this.maxSubband = maxSubband;
    this.graceDelay = Objects.requireNonNull(graceDelay, "graceDelay");
  }

  @Override
  public SubbandRange resolve(Path inputDirectory) throws IOException, InterruptedException {
    Objects.requireNonNull(inputDirectory, "inputDirectory");
    if (manualSubbands) {
      SubbandRange range = new SubbandRange(minSubband, maxSubband);
      log.info("Using configured subbands {}", range);
      return range;
    }
    if (!graceDelay.isZero() && !graceDelay.isNegative()) {
      Thread.sleep(graceDelay.toMillis());
    }
    Optional<Path> descriptor = findDescriptor(inputDirectory);
    if (descriptor.isPresent()) {
      Optional<SubbandRange> parsed = parseRange(Files.readAllLines(descriptor.get(), StandardCharsets.UTF_8));
      if (parsed.isPresent()) {
        log.info("Subbands {} read from {}", parsed.get(), descriptor.get().getFileName());
        return parsed.get();
      }
      log.warn("Descriptor {} has no subbands entry", descriptor.get());
    } else {
      log.warn("No observation descriptor (.h, .sh) in {}", inputDirectory);
    }
    if (minSubband != null && maxSubband != null) {
      SubbandRange fallback = new SubbandRange(minSubband, maxSubband);
      log.info("Falling back to configured subbands {}", fallback);
      return fallback;
    }
    throw new ObservationSetupException(
        "No subband information found in " + inputDirectory + " and no minSubband/maxSubband configured");
  }

  /**
   * Finds the descriptor file.
   *
   * @param directory input directory
   * @return first {@code .h}/{@code .sh} file in name order
   * @throws IOException if the directory cannot be listed
   */
  public static Optional<Path> findDescriptor(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> {
            String name = path.getFileName().toString();
            return name.endsWith(".h") || name.endsWith(".sh");
          })
          .sorted()
          .findFirst();
    }
  }

  /**
   * Parses {@code key=value} lines.
   *
   * @param lines descriptor lines
   * @return keys mapped to values with surrounding whitespace and quotes removed; first occurrence wins
   */
  public static Map<String, String> parseKeyValues(List<String> lines) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String raw : lines) {
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      int eq = line.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      String key = line.substring(0, eq).strip();
      String value = unquote(line.substring(eq + 1).strip());
      values.putIfAbsent(key, value);
    }
    return values;
  }

  /**
   * Extracts the subband range from descriptor lines.
   *
   * @param lines descriptor lines
   * @return range, or empty when none is declared
   * @throws ObservationSetupException if a declared range is malformed
   */
  public static Optional<SubbandRange> parseRange(List<String> lines) {
    String expression = parseKeyValues(lines).get(SUBBANDS_KEY);
    if (expression == null) {
      expression = findFlag(lines);
    }
    if (expression == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(SubbandRange.parse(expression));
    } catch (IllegalArgumentException ex) {
      throw new ObservationSetupException("Malformed subbands entry '" + expression + "'", ex);
    }
  }

  private static String findFlag(List<String> lines) {
    for (String line : lines) {
      int start = line.indexOf(SUBBANDS_FLAG);
      if (start < 0) {
        continue;
      }
      String rest = line.substring(start + SUBBANDS_FLAG.length()).strip();
      int end = 0;
      while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
        end++;
      }
      return unquote(rest.substring(0, end));
    }
    return null;
  }

  private static String unquote(String value) {
    String result = value;
    while (result.length() >= 2
        && (result.startsWith("\"") && result.endsWith("\"") || result.startsWith("'") && result.endsWith("'"))) {
      result = result.substring(1, result.length() - 1).strip();
    }
    return result;
  }
}
