package org.lofarimaging.realtime.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies complete XST blocks framed from a growing stream.
 * <p><strong>Why:</strong> Hides file tailing and partial-read buffering so the observation loop only ever sees
 * whole correlation matrices.</p>
 * <p><strong>Role:</strong> Implemented by {@code XstFileTailer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the stream and release it on close.</li>
 *   <li>Accumulate appended bytes and emit exactly block-sized slices, in stream order.</li>
 *   <li>Never emit a partial block.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded polling by the observation loop.</p>
 * <p><strong>Observability:</strong> Implementations emit {@code observe.stream.*} metrics.</p>
 *
 * @implNote Callers must invoke {@link #start()} before polling and always call {@link #close()}.
 * @since 0.1.0
 */
public interface BlockSource extends AutoCloseable {
  /**
   * Opens the underlying stream.
   *
   * @throws Exception if the stream cannot be opened; fatal for the observation
   */
  void start() throws Exception;

  /**
   * Returns the next complete block when one is available.
   *
   * <p>Implementations may sleep for their poll interval when no new bytes arrived.</p>
   *
   * @return block bytes of exactly {@link #blockSizeBytes()} length; empty when no complete block is buffered yet
   * @throws Exception if reading fails or the calling thread is interrupted
   */
  Optional<byte[]> poll() throws Exception;

  /**
   * Hands out a whole block that was already read, without reading the stream or sleeping. The observation loop
   * calls this after a stop until it returns empty, so blocks that arrived in one read are still archived.
   *
   * @return next buffered block, or empty when less than a block is held
   */
  default Optional<byte[]> pollBuffered() {
    return Optional.empty();
  }

  /** Size of one block in bytes. */
  int blockSizeBytes();

  /**
   * Releases the stream. Bytes of an incomplete trailing block are discarded.
   *
   * @throws Exception if the stream cannot be closed
   */
  @Override
  void close() throws Exception;
}
