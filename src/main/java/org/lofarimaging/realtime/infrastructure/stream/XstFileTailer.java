package org.lofarimaging.realtime.infrastructure.stream;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.lofarimaging.realtime.application.port.BlockSource;
import org.lofarimaging.realtime.application.port.MetricsPort;
import org.lofarimaging.realtime.infrastructure.buffer.BlockAccumulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link BlockSource} that tails an append-only XST file and frames it into fixed-size
 * blocks.
 * <p><strong>How:</strong> Each {@link #poll()} first hands out a block already buffered; otherwise it reads
 * whatever the writer has appended since the last call (bounded per call) into a {@link BlockAccumulator}. When
 * nothing new arrived it sleeps for the poll interval, which is its only suspension point. Bytes are emitted
 * strictly in file order and never as a partial block.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded; polled by the observation loop.</p>
 * <p><strong>Observability:</strong> {@code observe.stream.bytes}, {@code observe.stream.blocks}, and on close
 * {@code observe.stream.discarded.blocks} or {@code observe.stream.discarded.bytes} for whatever was left.</p>
 *
 * @since 0.1.0
 */
public final class XstFileTailer implements BlockSource {
  private static final Logger log = LoggerFactory.getLogger(XstFileTailer.class);

  private static final int MIN_READ_CHUNK = 1 << 20;

  private final Path file;
  private final int blockSizeBytes;
  private final Duration pollInterval;
  private final MetricsPort metrics;
  private final int maxReadBytes;
  private final BlockAccumulator buffer;

  private FileChannel channel;
  private long blocksEmitted;

  /**
   * Creates a tailer.
   *
   * @param file stream file
   * @param blockSizeBytes size of one block
   * @param pollInterval sleep when no new bytes are available
   * @param metrics metrics sink
   */
  public XstFileTailer(Path file, int blockSizeBytes, Duration pollInterval, MetricsPort metrics) {
    this.file = Objects.requireNonNull(file, "file");
    if (blockSizeBytes <= 0) {
      throw new IllegalArgumentException("blockSizeBytes must be positive");
    }
    this.blockSizeBytes = blockSizeBytes;
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.maxReadBytes = Math.max(MIN_READ_CHUNK, blockSizeBytes * 4);
    this.buffer = new BlockAccumulator(blockSizeBytes, 2);
  }

  @Override
  public void start() throws IOException {
    if (channel != null) {
      throw new IllegalStateException("Tailer already started");
    }
    channel = FileChannel.open(file, StandardOpenOption.READ);
    log.info("Tailing {} in blocks of {} bytes", file, blockSizeBytes);
  }

  @Override
  public Optional<byte[]> poll() throws IOException, InterruptedException {
    FileChannel ch = channel;
    if (ch == null) {
      throw new IllegalStateException("Tailer not started");
    }
    if (buffer.hasBlock()) {
      return Optional.of(emit());
    }
    long available = ch.size() - ch.position();
    int read = 0;
    if (available > 0) {
      read = buffer.fill(ch, (int) Math.min(available, maxReadBytes));
    }
    if (read > 0) {
      metrics.observe("observe.stream.bytes", read);
      if (buffer.hasBlock()) {
        return Optional.of(emit());
      }
      return Optional.empty();
    }
    Thread.sleep(pollInterval.toMillis());
    return Optional.empty();
  }

  @Override
  public Optional<byte[]> pollBuffered() {
    return buffer.hasBlock() ? Optional.of(emit()) : Optional.empty();
  }

  @Override
  public int blockSizeBytes() {
    return blockSizeBytes;
  }

  /** Bytes buffered but not yet emitted. */
  public int bufferedBytes() {
    return buffer.buffered();
  }

  public long blocksEmitted() {
    return blocksEmitted;
  }

  @Override
  public void close() throws IOException {
    FileChannel ch = channel;
    channel = null;
    int leftover = buffer.reset();
    int wholeBlocks = leftover / blockSizeBytes;
    int partialBytes = leftover % blockSizeBytes;
    if (wholeBlocks > 0) {
      metrics.observe("observe.stream.discarded.blocks", wholeBlocks);
      log.warn("Discarding {} whole blocks that were buffered but never polled", wholeBlocks);
    }
    if (partialBytes > 0) {
      metrics.observe("observe.stream.discarded.bytes", partialBytes);
      log.info("Discarding {} bytes of an incomplete trailing block", partialBytes);
    }
    if (ch != null) {
      ch.close();
      log.info("Closed {} after {} blocks", file, blocksEmitted);
    }
  }

  private byte[] emit() {
    blocksEmitted++;
    metrics.increment("observe.stream.blocks");
    return buffer.nextBlock();
  }
}
