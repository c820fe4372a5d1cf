package org.lofarimaging.realtime.domain.block;

import java.util.Objects;

/**
 * <strong>What:</strong> Maps a block index to the subband the station was observing when it produced it.
 * <p><strong>Why:</strong> The receiver steps through the configured range one subband per block and wraps
 * after the last one; the stream itself carries no subband tag.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class SubbandCycler {
  private SubbandCycler() {
    // Utility
  }

  /**
   * Returns {@code min + (index mod (max - min + 1))}.
   *
   * @param index zero-based block index; must be non-negative
   * @param min first subband, inclusive
   * @param max last subband, inclusive; must be {@code >= min}
   * @return subband within {@code [min, max]}
   * @throws IllegalArgumentException if the index is negative or the bounds are invalid
   */
  public static int subband(long index, int min, int max) {
    return subband(index, new SubbandRange(min, max));
  }

  /**
   * Range-typed variant of {@link #subband(long, int, int)}.
   *
   * @param index zero-based block index; must be non-negative
   * @param range subband range of the observation
   * @return subband within the range
   */
  public static int subband(long index, SubbandRange range) {
    Objects.requireNonNull(range, "range");
    if (index < 0) {
      throw new IllegalArgumentException("block index must be non-negative (was " + index + ")");
    }
    return range.min() + (int) (index % range.width());
  }
}
