package org.lofarimaging.realtime.infrastructure.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.Arrays;
import java.util.Objects;

/**
 * Collects bytes read from a growing stream file and cuts them into fixed-size blocks.
 *
 * <p>Unread bytes always sit between {@code head} and {@code tail} of one backing array. Before a fill the
 * unread bytes are shifted to the front; the array doubles only when a fill still would not fit. Blocks come
 * out in the order their bytes were read. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class BlockAccumulator {
  private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

  private final int blockSize;
  private byte[] storage;
  private int head;
  private int tail;

  /**
   * Creates an accumulator.
   *
   * @param blockSize bytes per block
   * @param initialBlocks blocks the backing array holds before it first grows
   * @throws IllegalArgumentException if either argument is not positive
   */
  public BlockAccumulator(int blockSize, int initialBlocks) {
    if (blockSize <= 0) {
      throw new IllegalArgumentException("blockSize must be positive");
    }
    if (initialBlocks <= 0) {
      throw new IllegalArgumentException("initialBlocks must be positive");
    }
    this.blockSize = blockSize;
    this.storage = new byte[Math.multiplyExact(blockSize, initialBlocks)];
  }

  /**
   * Reads up to {@code maxBytes} from {@code channel} behind the bytes already held.
   *
   * @param channel channel positioned at the next unread byte of the stream
   * @param maxBytes upper bound for this call
   * @return bytes read, {@code 0} when nothing was available, or {@code -1} at end of stream
   * @throws IOException if the channel read fails
   */
  public int fill(ReadableByteChannel channel, int maxBytes) throws IOException {
    Objects.requireNonNull(channel, "channel");
    if (maxBytes <= 0) {
      return 0;
    }
    makeRoom(maxBytes);
    int read = channel.read(ByteBuffer.wrap(storage, tail, maxBytes));
    if (read > 0) {
      tail += read;
    }
    return read;
  }

  /** Whether at least one whole block is buffered. */
  public boolean hasBlock() {
    return buffered() >= blockSize;
  }

  /** Bytes held but not yet handed out. */
  public int buffered() {
    return tail - head;
  }

  public int blockSize() {
    return blockSize;
  }

  /**
   * Removes the oldest whole block.
   *
   * @return a fresh array of {@link #blockSize()} bytes
   * @throws IllegalStateException if less than a block is buffered
   */
  public byte[] nextBlock() {
    if (!hasBlock()) {
      throw new IllegalStateException(
          "no complete block buffered (" + buffered() + " of " + blockSize + " bytes)");
    }
    byte[] block = Arrays.copyOfRange(storage, head, head + blockSize);
    head += blockSize;
    if (head == tail) {
      head = 0;
      tail = 0;
    }
    return block;
  }

  /**
   * Drops everything buffered, including a partial block.
   *
   * @return number of bytes dropped
   */
  public int reset() {
    int dropped = buffered();
    head = 0;
    tail = 0;
    return dropped;
  }

  private void makeRoom(int bytes) {
    if (storage.length - tail >= bytes) {
      return;
    }
    int pending = buffered();
    if (head > 0) {
      System.arraycopy(storage, head, storage, 0, pending);
      head = 0;
      tail = pending;
      if (storage.length - tail >= bytes) {
        return;
      }
    }
    long needed = (long) pending + bytes;
    if (needed > MAX_ARRAY_SIZE) {
      throw new IllegalStateException("cannot buffer " + needed + " bytes");
    }
    long capacity = storage.length;
    while (capacity < needed) {
      capacity <<= 1;
    }
    storage = Arrays.copyOf(storage, (int) Math.min(capacity, MAX_ARRAY_SIZE));
  }
}
