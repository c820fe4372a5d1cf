package org.lofarimaging.realtime.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.lofarimaging.realtime.domain.block.BlockArtifactNames;
import org.lofarimaging.realtime.domain.block.SubbandRange;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.station.StationType;
import org.lofarimaging.realtime.validation.Strings;

/**
 * Configuration of the {@code simulate} command, which replays a recorded XST file into a growing stream.
 *
 * @param source recorded XST file
 * @param target stream file to write; must end in {@code _xst.dat}
 * @param stationName station the recording came from; fixes the block size
 * @param range subband range written to the descriptor
 * @param interval pause after each block
 * @since 0.1.0
 */
public record SimulateConfig(Path source, Path target, String stationName, SubbandRange range, Duration interval) {
  public SimulateConfig {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    stationName = Strings.requireStationName("station", stationName);
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(interval, "interval");
    if (!target.getFileName().toString().endsWith(BlockArtifactNames.DATA_SUFFIX)) {
      throw new IllegalArgumentException("target must end in " + BlockArtifactNames.DATA_SUFFIX + " (was " + target + ")");
    }
  }

  /**
   * Builds the configuration from flattened key/value pairs.
   *
   * @param options merged defaults, YAML and CLI values
   * @return validated configuration
   * @throws IllegalArgumentException if {@code source} or {@code target} is missing or a value is invalid
   */
  public static SimulateConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path source = ObservationConfig.parsePath("source", options.get("source"), null);
    if (source == null) {
      throw new IllegalArgumentException("source is required");
    }
    Path target = ObservationConfig.parsePath("target", options.get("target"), null);
    if (target == null) {
      throw new IllegalArgumentException("target is required");
    }
    int min = ObservationConfig.parseBoundedInt(options, "minSubband", 100, 0, ObservationConfig.MAX_SUBBAND);
    int max = ObservationConfig.parseBoundedInt(options, "maxSubband", min, 0, ObservationConfig.MAX_SUBBAND);
    if (min > max) {
      throw new IllegalArgumentException("minSubband must not exceed maxSubband (" + min + " > " + max + ")");
    }
    String station = Objects.requireNonNullElse(ObservationConfig.trimToNull(options.get("station")), "LV614");
    long intervalMillis = ObservationConfig.parseBoundedInt(options, "intervalMillis", 1000, 0, 3_600_000);
    return new SimulateConfig(source, target, station, new SubbandRange(min, max), Duration.ofMillis(intervalMillis));
  }

  /** Bytes per block for the configured station. */
  public int blockSizeBytes() {
    return XstBlock.sizeInBytes(StationType.fromStationName(stationName).rcuCount());
  }
}
