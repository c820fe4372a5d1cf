package org.lofarimaging.realtime.domain.status;

import java.time.Instant;
import java.util.Objects;

/**
 * One rendered image recorded in the observation's session log.
 *
 * @param timestamp block timestamp the image was rendered from
 * @param filename image path relative to the images root ({@code <observation>/images/<file>})
 * @param subband subband of the rendered block
 * @param status outcome label, {@value #STATUS_PROCESSED} for live renders
 * @param durationSeconds render wall time in seconds, or {@code null} when unknown
 * @param frameIndex block sequence the image belongs to, or {@code null} when unknown
 * @since 0.1.0
 */
public record ImageLogEntry(
    Instant timestamp, String filename, int subband, String status, Double durationSeconds, Long frameIndex) {
  /** Status label recorded for images rendered during an observation. */
  public static final String STATUS_PROCESSED = "processed";

  public ImageLogEntry {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(filename, "filename");
    status = status == null ? STATUS_PROCESSED : status;
  }
}
