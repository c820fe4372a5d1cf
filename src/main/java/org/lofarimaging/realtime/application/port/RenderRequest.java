package org.lofarimaging.realtime.application.port;

import java.nio.file.Path;
import java.util.Objects;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.station.StationGeometry;

/**
 * Inputs for rendering one block.
 *
 * @param block block to image
 * @param station station identity and imaging geometry
 * @param outputDir directory the renderer writes images into
 * @param caltableDir calibration table directory, or {@code null} to let the renderer use its default
 * @since 0.1.0
 */
public record RenderRequest(XstBlock block, StationGeometry station, Path outputDir, Path caltableDir) {
  public RenderRequest {
    Objects.requireNonNull(block, "block");
    Objects.requireNonNull(station, "station");
    Objects.requireNonNull(outputDir, "outputDir");
  }
}
