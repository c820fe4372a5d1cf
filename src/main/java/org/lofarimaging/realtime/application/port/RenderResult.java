package org.lofarimaging.realtime.application.port;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.lofarimaging.realtime.domain.status.TrackingSample;

/**
 * Images and tracking data produced for one block.
 *
 * @param skyImage all-sky image, when produced
 * @param nearFieldImage near-field image, when produced; drives the image log
 * @param tracking strongest-source position, when the renderer tracked one
 * @since 0.1.0
 */
public record RenderResult(
    Optional<Path> skyImage, Optional<Path> nearFieldImage, Optional<TrackingSample> tracking) {
  private static final RenderResult EMPTY = new RenderResult(Optional.empty(), Optional.empty(), Optional.empty());

  public RenderResult {
    skyImage = Objects.requireNonNullElse(skyImage, Optional.empty());
    nearFieldImage = Objects.requireNonNullElse(nearFieldImage, Optional.empty());
    tracking = Objects.requireNonNullElse(tracking, Optional.empty());
  }

  /** Result carrying nothing. */
  public static RenderResult empty() {
    return EMPTY;
  }
}
