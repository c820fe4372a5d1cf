package org.lofarimaging.realtime.application.state;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for one observation, passed explicitly to the producer loop and every render task.
 *
 * <p>Once cancelled a token stays cancelled; a new observation gets a new token.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /**
   * Requests cancellation.
   *
   * @return {@code true} if this call changed the token's state
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancellationRequested() {
    return cancelled.get();
  }

  @Override
  public String toString() {
    return "CancellationToken{cancelled=" + cancelled.get() + '}';
  }
}
