package org.lofarimaging.realtime.application.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.lofarimaging.realtime.application.state.RunParameters;
import org.lofarimaging.realtime.domain.station.StationGeometry;

/**
 * Validated parameters of one observation run.
 *
 * @param inputDirectory directory the station receiver writes its stream and descriptor into
 * @param imagesRoot parent directory for observation directories
 * @param station station identity and imaging geometry
 * @param caltableDir calibration tables, or {@code null}
 * @param dispatch render pool size, queue capacity, and decimation step
 * @param drainTimeout upper bound on waiting for in-flight renders at shutdown
 * @since 0.1.0
 */
public record ObservationSettings(
    Path inputDirectory,
    Path imagesRoot,
    StationGeometry station,
    Path caltableDir,
    RenderDispatcher.Settings dispatch,
    Duration drainTimeout) {
  public ObservationSettings {
    Objects.requireNonNull(inputDirectory, "inputDirectory");
    Objects.requireNonNull(imagesRoot, "imagesRoot");
    Objects.requireNonNull(station, "station");
    Objects.requireNonNull(dispatch, "dispatch");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must not be negative");
    }
  }

  /** Parameters echoed in the status snapshot. */
  public RunParameters runParameters() {
    return new RunParameters(
        dispatch.workers(), dispatch.step(), station.heightMetres(), station.extentMetres());
  }
}
