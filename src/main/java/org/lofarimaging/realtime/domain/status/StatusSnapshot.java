package org.lofarimaging.realtime.domain.status;

import org.lofarimaging.realtime.domain.block.SubbandRange;

/**
 * Point-in-time view of the observation, assembled without holding any lock during computation.
 *
 * @param status lifecycle status
 * @param lastBlockNumber one-based number of the last block read, or {@code null} before the first block
 * @param lastSubband subband of the last logged image, or {@code null}
 * @param pendingCount render tasks submitted and not yet finished
 * @param avgProcessingSeconds mean of the last render durations, rounded to 2 places
 * @param currentFile stream file being tailed, or {@code null}
 * @param subbandRange subband range of the observation, or {@code null}
 * @param threads render worker count
 * @param step decimation step
 * @param heightMetres imaging height
 * @param extentMetres image half-width
 * @param lastTracking most recent tracking sample rounded for display, or {@code null}
 * @param velocityMps speed estimate rounded to 2 places, or {@code null} when undefined
 * @since 0.1.0
 */
public record StatusSnapshot(
    SystemStatus status,
    Long lastBlockNumber,
    Integer lastSubband,
    int pendingCount,
    double avgProcessingSeconds,
    String currentFile,
    SubbandRange subbandRange,
    int threads,
    int step,
    double heightMetres,
    double extentMetres,
    TrackingSample lastTracking,
    Double velocityMps) {

  /** Rounds to two decimal places, half-even. */
  public static double round2(double value) {
    return TrackingSample.round(value, 2);
  }

  /** One-line summary for periodic logging. */
  public String summaryLine() {
    return "status=" + status.label()
        + " lastBlock=" + lastBlockNumber
        + " lastSubband=" + lastSubband
        + " pending=" + pendingCount
        + " avgProcessingSec=" + avgProcessingSeconds
        + " range=" + subbandRange
        + " velocityMps=" + velocityMps;
  }
}
