package org.lofarimaging.realtime.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for creating the executors used by the observation pipeline.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size render pool backed by a bounded queue. When the queue is full, {@code execute} blocks the
   * submitting thread until a slot frees up; once the pool is shut down, submissions are rejected.
   *
   * @param size number of worker threads
   * @param queueCapacity maximum tasks waiting for a worker
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newRenderPool(
      int size, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    ThreadFactory factory = namedFactory(prefix, "render", false, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        factory,
        new BlockWhenFullPolicy());
  }

  /**
   * Builds a single-thread daemon scheduler for periodic background work such as status reporting.
   *
   * @param prefix thread-name prefix
   * @return scheduler
   */
  public static ScheduledExecutorService newDaemonScheduler(String prefix) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, namedFactory(prefix, "scheduler", true, null));
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  private static ThreadFactory namedFactory(
      String prefix, String fallbackPrefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallbackPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler =
        Objects.requireNonNullElse(
            handler,
            (t, ex) -> log.error("Thread {} terminated with an uncaught exception", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /** Blocks the submitter on a full queue instead of rejecting the task. */
  static final class BlockWhenFullPolicy implements RejectedExecutionHandler {
    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
      if (executor.isShutdown()) {
        throw new RejectedExecutionException("Render pool is shut down");
      }
      try {
        executor.getQueue().put(task);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new RejectedExecutionException("Interrupted while waiting for render queue capacity", ie);
      }
      if (executor.isShutdown() && executor.getQueue().remove(task)) {
        throw new RejectedExecutionException("Render pool shut down while task was queued");
      }
    }
  }
}
