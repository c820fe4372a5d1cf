package org.lofarimaging.realtime.domain.block;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> One framed XST correlation matrix cut from the station stream.
 * <p><strong>Why:</strong> Carries the raw sample bytes together with the bookkeeping the archive and the
 * renderer need (sequence, wall-clock timestamp, subband).</p>
 * <p><strong>Role:</strong> Domain value handed from the stream tailer to the block archive and the render
 * dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 * <p><strong>Performance:</strong> Clones the sample buffer once on construction; {@link #data()} returns the
 * internal copy, callers must not mutate it.</p>
 *
 * @param sequence zero-based position of the block in arrival order
 * @param timestamp wall-clock time the block was framed (UTC)
 * @param subband subband assigned by the subband cycle
 * @param dimension matrix side length, equal to the station RCU count
 * @param data {@code dimension² × 16} bytes of little-endian complex128 samples; copied on construction
 * @since 0.1.0
 */
public record XstBlock(long sequence, Instant timestamp, int subband, int dimension, byte[] data) {
  /** Bytes per complex128 sample (two little-endian IEEE-754 doubles). */
  public static final int BYTES_PER_SAMPLE = 16;

  /**
   * Validates the block geometry and copies the sample buffer.
   *
   * @throws IllegalArgumentException if the buffer length does not match the dimension
   */
  public XstBlock {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(data, "data");
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be non-negative");
    }
    if (subband < 0) {
      throw new IllegalArgumentException("subband must be non-negative");
    }
    long expected = sizeInBytes(dimension);
    if (data.length != expected) {
      throw new IllegalArgumentException(
          "block data must hold " + expected + " bytes for dimension " + dimension + " (was " + data.length + ")");
    }
    data = data.clone();
  }

  /**
   * Returns the byte length of a square complex128 matrix of the given dimension.
   *
   * @param dimension matrix side length; must be positive
   * @return {@code dimension² × 16}
   */
  public static int sizeInBytes(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("dimension must be positive");
    }
    return Math.multiplyExact(Math.multiplyExact(dimension, dimension), BYTES_PER_SAMPLE);
  }

  /**
   * Returns the 1-based block number used for decimation.
   *
   * @return {@code sequence + 1}
   */
  public long blockNumber() {
    return sequence + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof XstBlock that)) {
      return false;
    }
    return sequence == that.sequence()
        && subband == that.subband()
        && dimension == that.dimension()
        && timestamp.equals(that.timestamp())
        && Arrays.equals(data, that.data());
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(sequence);
    result = 31 * result + timestamp.hashCode();
    result = 31 * result + Integer.hashCode(subband);
    result = 31 * result + Integer.hashCode(dimension);
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  @Override
  public String toString() {
    return "XstBlock{"
        + "sequence=" + sequence
        + ", timestamp=" + timestamp
        + ", subband=" + subband
        + ", dimension=" + dimension
        + ", bytes=" + data.length
        + '}';
  }
}
