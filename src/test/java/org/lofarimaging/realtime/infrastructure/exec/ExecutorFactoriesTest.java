package org.lofarimaging.realtime.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void renderPoolNamesThreadsAndIsNonDaemon() throws Exception {
    ThreadPoolExecutor pool = ExecutorFactories.newRenderPool(2, 4, "render-test", null);
    AtomicReference<Thread> seen = new AtomicReference<>();
    CountDownLatch ran = new CountDownLatch(1);
    pool.execute(() -> {
      seen.set(Thread.currentThread());
      ran.countDown();
    });
    assertTrue(ran.await(5, TimeUnit.SECONDS));
    pool.shutdown();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

    assertTrue(seen.get().getName().startsWith("render-test-"));
    assertFalse(seen.get().isDaemon());
    assertEquals(2, pool.getCorePoolSize());
    assertEquals(2, pool.getMaximumPoolSize());
  }

  @Test
  void submissionAfterShutdownIsRejected() {
    ThreadPoolExecutor pool = ExecutorFactories.newRenderPool(1, 1, "render-test", null);
    pool.shutdown();
    assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
  }

  @Test
  void fullQueueBlocksInsteadOfRejecting() throws Exception {
    ThreadPoolExecutor pool = ExecutorFactories.newRenderPool(1, 1, "render-test", null);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    pool.execute(() -> {
      started.countDown();
      awaitQuietly(release);
    });
    assertTrue(started.await(5, TimeUnit.SECONDS));
    pool.execute(() -> { });

    Thread producer = new Thread(() -> pool.execute(() -> { }), "producer");
    producer.start();
    producer.join(200);
    assertTrue(producer.isAlive());

    release.countDown();
    producer.join(5_000);
    assertFalse(producer.isAlive());
    pool.shutdown();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    assertEquals(3, pool.getCompletedTaskCount());
  }

  @Test
  void schedulerThreadsAreDaemons() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newDaemonScheduler("status-test");
    AtomicReference<Thread> seen = new AtomicReference<>();
    scheduler.schedule(() -> seen.set(Thread.currentThread()), 0, TimeUnit.MILLISECONDS).get(5, TimeUnit.SECONDS);
    scheduler.shutdownNow();

    assertTrue(seen.get().isDaemon());
    assertTrue(seen.get().getName().startsWith("status-test-"));
  }

  @Test
  void rejectsInvalidSizing() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newRenderPool(0, 1, "x", null));
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newRenderPool(1, 0, "x", null));
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }
}
