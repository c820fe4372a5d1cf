package org.lofarimaging.realtime.application.pipeline;

/**
 * What the dispatcher did with an offered block.
 *
 * @since 0.1.0
 */
public enum DispatchDecision {
  /** Skipped by the decimation step. */
  DECIMATED,
  /** Discarded because a stop was requested before submission. */
  DISCARDED_SHUTDOWN,
  /** Handed to the render pool. */
  SUBMITTED,
  /** Refused by the render pool; the pending counter was restored. */
  REJECTED
}
