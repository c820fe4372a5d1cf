package org.lofarimaging.realtime.infrastructure.render;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.lofarimaging.realtime.application.port.RenderResult;
import org.lofarimaging.realtime.domain.status.TrackingSample;
import org.lofarimaging.realtime.infrastructure.json.JsonSupport;

/**
 * Parses the imager's stdout contract: {@code sky=<path>}, {@code nearfield=<path>} and
 * {@code tracking=<json object>} lines. Other lines are ignored; relative paths resolve against the output
 * directory; the last occurrence of a key wins.
 *
 * @since 0.1.0
 */
final class RenderOutputParser {
  private static final String SKY = "sky=";
  private static final String NEAR_FIELD = "nearfield=";
  private static final String TRACKING = "tracking=";

  private final JsonSupport json = new JsonSupport();

  RenderResult parse(List<String> lines, Path outputDir) throws IOException {
    Objects.requireNonNull(lines, "lines");
    Objects.requireNonNull(outputDir, "outputDir");
    Optional<Path> sky = Optional.empty();
    Optional<Path> nearField = Optional.empty();
    Optional<TrackingSample> tracking = Optional.empty();
    for (String raw : lines) {
      String line = raw.strip();
      if (line.startsWith(SKY)) {
        sky = toPath(line.substring(SKY.length()), outputDir);
      } else if (line.startsWith(NEAR_FIELD)) {
        nearField = toPath(line.substring(NEAR_FIELD.length()), outputDir);
      } else if (line.startsWith(TRACKING)) {
        tracking = Optional.of(parseTracking(line.substring(TRACKING.length())));
      }
    }
    return new RenderResult(sky, nearField, tracking);
  }

  TrackingSample parseTracking(String text) throws IOException {
    Map<String, Object> object = JsonSupport.asObject(json.parse(text), "Tracking payload");
    Object timestamp = object.get("timestamp");
    Double subband = JsonSupport.optionalDouble(object, "subband");
    return new TrackingSample(
        timestamp == null ? null : timestamp.toString(),
        JsonSupport.requiredDouble(object, "lat"),
        JsonSupport.requiredDouble(object, "lon"),
        JsonSupport.requiredDouble(object, "x_m"),
        JsonSupport.requiredDouble(object, "y_m"),
        JsonSupport.requiredDouble(object, "power_db"),
        subband == null ? null : subband.intValue());
  }

  private static Optional<Path> toPath(String value, Path outputDir) {
    String trimmed = value.strip();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    Path path = Path.of(trimmed);
    return Optional.of(path.isAbsolute() ? path : outputDir.resolve(path));
  }
}
