package org.lofarimaging.realtime.domain.status;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * <strong>What:</strong> Position of the strongest near-field source reported by the renderer for one block.
 * <p><strong>Why:</strong> The status view shows the last position and a speed estimate derived from
 * consecutive samples.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>The timestamp is kept as the renderer reported it; {@link #instant()} parses it lazily so a malformed
 * value only disqualifies the pairs it takes part in.</p>
 *
 * @param timestamp ISO-8601 timestamp as reported by the renderer
 * @param lat latitude of the source in degrees
 * @param lon longitude of the source in degrees
 * @param xMetres east offset from the station centre in metres
 * @param yMetres north offset from the station centre in metres
 * @param powerDb peak power in dB
 * @param subband subband of the block, or {@code null} when not reported
 * @since 0.1.0
 */
public record TrackingSample(
    String timestamp, double lat, double lon, double xMetres, double yMetres, double powerDb, Integer subband) {

  /**
   * Parses the timestamp. Offset-qualified values are honoured, local values are read as UTC, and a space
   * is accepted in place of the {@code T} separator.
   *
   * @return parsed instant, or empty when the timestamp is missing or malformed
   */
  public Optional<Instant> instant() {
    if (timestamp == null || timestamp.isBlank()) {
      return Optional.empty();
    }
    String normalized = timestamp.strip().replace(' ', 'T');
    try {
      return Optional.of(OffsetDateTime.parse(normalized).toInstant());
    } catch (DateTimeParseException notOffset) {
      try {
        return Optional.of(LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC));
      } catch (DateTimeParseException malformed) {
        return Optional.empty();
      }
    }
  }

  /**
   * Returns a copy rounded for display: coordinates to 6 places, metres and power to 2.
   *
   * @return rounded sample
   */
  public TrackingSample rounded() {
    return new TrackingSample(
        timestamp,
        round(lat, 6),
        round(lon, 6),
        round(xMetres, 2),
        round(yMetres, 2),
        round(powerDb, 2),
        subband);
  }

  static double round(double value, int places) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value)
        .setScale(places, RoundingMode.HALF_EVEN)
        .doubleValue();
  }
}
