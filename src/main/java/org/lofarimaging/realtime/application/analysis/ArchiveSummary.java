package org.lofarimaging.realtime.application.analysis;

import java.time.Instant;
import java.util.List;

/**
 * Summary of an archived block directory.
 *
 * @param numberOfFiles number of artifact pairs
 * @param firstSubband lowest subband seen, or {@code null} when empty
 * @param lastSubband highest subband seen, or {@code null} when empty
 * @param distinctSubbands number of distinct subbands
 * @param startTime earliest block timestamp, or {@code null} when empty
 * @param endTime latest block timestamp, or {@code null} when empty
 * @param averageMeasurementsPerSubband mean number of blocks per subband, rounded to 2 places
 * @param measurementDurationSeconds time span divided by the number of blocks, rounded to 2 places; {@code null}
 *     with fewer than two blocks
 * @param blocks artifact pairs sorted by timestamp then subband
 * @since 0.1.0
 */
public record ArchiveSummary(
    int numberOfFiles,
    Integer firstSubband,
    Integer lastSubband,
    int distinctSubbands,
    Instant startTime,
    Instant endTime,
    double averageMeasurementsPerSubband,
    Double measurementDurationSeconds,
    List<ArchivedBlock> blocks) {
  public ArchiveSummary {
    blocks = List.copyOf(blocks);
  }

  /** Printable report lines. */
  public List<String> describe() {
    return List.of(
        "Number of files: " + numberOfFiles,
        "First and last subband: " + firstSubband + " - " + lastSubband,
        "Total subbands: " + distinctSubbands,
        "Start time: " + startTime,
        "End time: " + endTime,
        "Average measurements per subband: " + averageMeasurementsPerSubband,
        "Average measurement duration: " + measurementDurationSeconds + " seconds");
  }
}
