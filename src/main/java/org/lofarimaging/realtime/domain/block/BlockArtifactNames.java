package org.lofarimaging.realtime.domain.block;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Naming contract for persisted block artifacts: {@code yyyyMMdd_HHmmss_xst.dat} plus a {@code _xst.h}
 * sidecar, stamped in UTC at one-second resolution.
 *
 * @since 0.1.0
 */
public final class BlockArtifactNames {
  /** Suffix of the raw sample file, shared with the live stream file. */
  public static final String DATA_SUFFIX = "_xst.dat";
  /** Suffix of the subband sidecar. */
  public static final String SIDECAR_SUFFIX = "_xst.h";

  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private BlockArtifactNames() {
    // Utility
  }

  /**
   * Formats the artifact stem for a block timestamp.
   *
   * @param timestamp block timestamp
   * @return stem such as {@code 20240301_101500}
   */
  public static String stem(Instant timestamp) {
    return STAMP.format(LocalDateTime.ofInstant(timestamp, ZoneOffset.UTC));
  }

  public static String dataFileName(Instant timestamp) {
    return stem(timestamp) + DATA_SUFFIX;
  }

  public static String sidecarFileName(Instant timestamp) {
    return stem(timestamp) + SIDECAR_SUFFIX;
  }

  /**
   * Recovers the UTC timestamp encoded in an artifact file name.
   *
   * @param fileName data or sidecar file name
   * @return timestamp, or empty when the name does not follow the contract
   */
  public static Optional<Instant> parseTimestamp(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    String stem;
    if (fileName.endsWith(DATA_SUFFIX)) {
      stem = fileName.substring(0, fileName.length() - DATA_SUFFIX.length());
    } else if (fileName.endsWith(SIDECAR_SUFFIX)) {
      stem = fileName.substring(0, fileName.length() - SIDECAR_SUFFIX.length());
    } else {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDateTime.parse(stem, STAMP).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
