package org.lofarimaging.realtime.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.lofarimaging.realtime.application.pipeline.ObservationSettings;
import org.lofarimaging.realtime.application.pipeline.RenderDispatcher;
import org.lofarimaging.realtime.domain.station.StationGeometry;
import org.lofarimaging.realtime.validation.Numbers;
import org.lofarimaging.realtime.validation.Strings;

/**
 * <strong>What:</strong> Validated configuration of the {@code observe} command.
 * <p><strong>Why:</strong> Collects station geometry, render pool sizing, subband fallback, renderer and
 * timing knobs in one immutable value so an observation can be reproduced from its arguments.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputDirectory directory the station receiver writes the stream and descriptor into
 * @param imagesRoot parent of the per-observation directories
 * @param stationName LOFAR station identifier
 * @param rcuMode RCU mode 1-7
 * @param heightMetres near-field imaging height
 * @param extentMetres near-field half width
 * @param threads render worker count
 * @param step decimation step; every {@code step}-th block is rendered
 * @param queueCapacity render tasks allowed to wait for a worker
 * @param pollInterval stream polling interval
 * @param drainTimeout wait bound for in-flight renders at shutdown
 * @param statusInterval period of {@code status.json} updates
 * @param graceDelay wait before looking for the observation descriptor
 * @param manualSubbands use the configured bounds without reading the descriptor
 * @param minSubband configured lower subband bound, or {@code null}
 * @param maxSubband configured upper subband bound, or {@code null}
 * @param caltableDir calibration table directory, or {@code null}
 * @param renderer renderer selection
 * @param rendererCommand external imaging command and leading arguments
 * @param renderTimeout wall-time bound of one external render
 * @param warmupFile recorded block rendered once before observing, or {@code null}
 * @param warmupSubband subband of the warm-up recording
 * @since 0.1.0
 */
public record ObservationConfig(
    Path inputDirectory,
    Path imagesRoot,
    String stationName,
    int rcuMode,
    double heightMetres,
    double extentMetres,
    int threads,
    int step,
    int queueCapacity,
    Duration pollInterval,
    Duration drainTimeout,
    Duration statusInterval,
    Duration graceDelay,
    boolean manualSubbands,
    Integer minSubband,
    Integer maxSubband,
    Path caltableDir,
    RendererMode renderer,
    List<String> rendererCommand,
    Duration renderTimeout,
    Path warmupFile,
    int warmupSubband) {

  static final Path DEFAULT_BASE = defaultBaseDirectory();
  static final int MAX_SUBBAND = 511;

  public ObservationConfig {
    Objects.requireNonNull(inputDirectory, "inputDirectory");
    Objects.requireNonNull(imagesRoot, "imagesRoot");
    stationName = Strings.requireStationName("station", stationName);
    Numbers.requireRange("rcuMode", rcuMode, 1, 7);
    Numbers.requireRange("heightM", heightMetres, 0d, 100_000d);
    Numbers.requireRange("extentM", extentMetres, 0.001d, 100_000d);
    Numbers.requireRange("threads", threads, 1, 256);
    Numbers.requireRange("step", step, 1, 1_000_000);
    Numbers.requireRange("queueCapacity", queueCapacity, 1, 65_536);
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    Objects.requireNonNull(statusInterval, "statusInterval");
    Objects.requireNonNull(graceDelay, "graceDelay");
    renderer = Objects.requireNonNullElse(renderer, RendererMode.NONE);
    rendererCommand = rendererCommand == null ? List.of() : List.copyOf(rendererCommand);
    Objects.requireNonNull(renderTimeout, "renderTimeout");
    if (minSubband != null) {
      Numbers.requireRange("minSubband", minSubband, 0, MAX_SUBBAND);
    }
    if (maxSubband != null) {
      Numbers.requireRange("maxSubband", maxSubband, 0, MAX_SUBBAND);
    }
    if (minSubband != null && maxSubband != null && minSubband > maxSubband) {
      throw new IllegalArgumentException(
          "minSubband must not exceed maxSubband (" + minSubband + " > " + maxSubband + ")");
    }
    if (manualSubbands && (minSubband == null || maxSubband == null)) {
      throw new IllegalArgumentException("manualSubbands=true requires minSubband and maxSubband");
    }
    if (renderer == RendererMode.PROCESS && rendererCommand.isEmpty()) {
      throw new IllegalArgumentException("renderer=process requires rendererCommand");
    }
    Numbers.requireRange("warmupSubband", warmupSubband, 0, MAX_SUBBAND);
  }

  /**
   * Returns the configuration used when no YAML or CLI values are supplied.
   *
   * @return default configuration rooted under {@code ~/.lofar}
   */
  public static ObservationConfig defaults() {
    return new ObservationConfig(
        DEFAULT_BASE.resolve("xst"),
        DEFAULT_BASE.resolve("images"),
        "LV614",
        3,
        1.5d,
        50d,
        4,
        1,
        16,
        Duration.ofMillis(200),
        Duration.ofHours(1),
        Duration.ofSeconds(5),
        Duration.ofMillis(500),
        false,
        null,
        null,
        null,
        RendererMode.NONE,
        List.of(),
        Duration.ofMinutes(10),
        null,
        0);
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param options merged defaults, YAML and CLI values
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ObservationConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ObservationConfig defaults = defaults();

    int threads = parseBoundedInt(options, "threads", defaults.threads(), 1, 256);
    String queueRaw = trimToNull(options.get("queueCapacity"));
    int queueCapacity =
        queueRaw == null ? threads * 4 : parseBoundedInt(options, "queueCapacity", threads * 4, 1, 65_536);

    return new ObservationConfig(
        parsePath("input", options.get("input"), defaults.inputDirectory()),
        parsePath("out", options.get("out"), defaults.imagesRoot()),
        Objects.requireNonNullElse(trimToNull(options.get("station")), defaults.stationName()),
        parseBoundedInt(options, "rcuMode", defaults.rcuMode(), 1, 7),
        parseDouble(options, "heightM", defaults.heightMetres()),
        parseDouble(options, "extentM", defaults.extentMetres()),
        threads,
        parseBoundedInt(options, "step", defaults.step(), 1, 1_000_000),
        queueCapacity,
        Duration.ofMillis(parseBoundedInt(options, "pollMillis", 200, 1, 60_000)),
        Duration.ofSeconds(parseBoundedInt(options, "drainTimeoutSec", 3600, 0, 86_400)),
        Duration.ofSeconds(parseBoundedInt(options, "statusIntervalSec", 5, 1, 3600)),
        Duration.ofMillis(parseBoundedInt(options, "graceDelayMillis", 500, 0, 60_000)),
        parseBoolean(options.get("manualSubbands"), false),
        parseOptionalInt(options, "minSubband"),
        parseOptionalInt(options, "maxSubband"),
        parsePath("caltableDir", options.get("caltableDir"), null),
        RendererMode.fromString(options.get("renderer")),
        splitCommand(options.get("rendererCommand")),
        Duration.ofSeconds(parseBoundedInt(options, "renderTimeoutSec", 600, 1, 86_400)),
        parsePath("warmupFile", options.get("warmupFile"), null),
        parseBoundedInt(options, "warmupSubband", 0, 0, MAX_SUBBAND));
  }

  /** Station identity and imaging geometry. */
  public StationGeometry station() {
    return StationGeometry.of(stationName, rcuMode, heightMetres, extentMetres);
  }

  /** Render pool sizing. */
  public RenderDispatcher.Settings dispatchSettings() {
    return new RenderDispatcher.Settings(threads, queueCapacity, step);
  }

  /** Run parameters handed to the observation use case. */
  public ObservationSettings toSettings() {
    return new ObservationSettings(
        inputDirectory, imagesRoot, station(), caltableDir, dispatchSettings(), drainTimeout);
  }

  static int parseBoundedInt(Map<String, String> options, String key, int fallback, int min, int max) {
    String raw = trimToNull(options.get(key));
    if (raw == null) {
      return fallback;
    }
    try {
      return (int) Numbers.requireRange(key, Long.parseLong(raw), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static Integer parseOptionalInt(Map<String, String> options, String key) {
    String raw = trimToNull(options.get(key));
    if (raw == null) {
      return null;
    }
    return parseBoundedInt(options, key, 0, 0, MAX_SUBBAND);
  }

  private static double parseDouble(Map<String, String> options, String key, double fallback) {
    String raw = trimToNull(options.get(key));
    if (raw == null) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  static boolean parseBoolean(String value, boolean fallback) {
    String raw = trimToNull(value);
    return raw == null ? fallback : Boolean.parseBoolean(raw);
  }

  static Path parsePath(String key, String value, Path fallback) {
    String raw = trimToNull(value);
    if (raw == null) {
      return fallback;
    }
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static List<String> splitCommand(String value) {
    String raw = trimToNull(value);
    if (raw == null) {
      return List.of();
    }
    return Arrays.asList(raw.split("\\s+"));
  }

  static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static Path defaultBaseDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".lofar");
  }
}
