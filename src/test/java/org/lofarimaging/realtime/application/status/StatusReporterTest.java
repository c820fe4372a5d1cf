package org.lofarimaging.realtime.application.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lofarimaging.realtime.application.port.StatusSink;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.application.state.RunParameters;
import org.lofarimaging.realtime.domain.observation.ObservationSession;
import org.lofarimaging.realtime.domain.status.StatusSnapshot;
import org.lofarimaging.realtime.domain.status.SystemStatus;

class StatusReporterTest {

  @Test
  void publishesOnlyOnceSessionExists(@TempDir Path root) throws Exception {
    ObservationState state = new ObservationState();
    RecordingSink sink = new RecordingSink(1);
    StatusReporter reporter =
        new StatusReporter(new StatusAggregator(state), sink, state, Duration.ofSeconds(60));

    StatusSnapshot idle = reporter.publishOnce();
    assertEquals(SystemStatus.IDLE, idle.status());
    assertTrue(sink.targets.isEmpty());

    state.tryBegin(new RunParameters(1, 1, 1.5, 50));
    ObservationSession session = ObservationSession.create(root, Instant.parse("2024-03-01T10:15:00Z"));
    state.attachSession(session);
    reporter.publishOnce();

    assertEquals(List.of(session.statusFile()), sink.targets);
  }

  @Test
  void scheduledPublishingRunsUntilClosed(@TempDir Path root) throws Exception {
    ObservationState state = new ObservationState();
    state.tryBegin(new RunParameters(1, 1, 1.5, 50));
    state.attachSession(ObservationSession.create(root, Instant.parse("2024-03-01T10:15:00Z")));
    RecordingSink sink = new RecordingSink(2);
    StatusReporter reporter =
        new StatusReporter(new StatusAggregator(state), sink, state, Duration.ofMillis(20));

    reporter.start();
    assertTrue(sink.published.await(5, TimeUnit.SECONDS));
    assertThrows(IllegalStateException.class, reporter::start);
    reporter.close();
    Thread.sleep(50);

    int afterClose = sink.targets.size();
    Thread.sleep(100);
    assertEquals(afterClose, sink.targets.size());
  }

  @Test
  void sinkFailureIsLoggedNotThrown(@TempDir Path root) throws Exception {
    ObservationState state = new ObservationState();
    state.attachSession(ObservationSession.create(root, Instant.parse("2024-03-01T10:15:00Z")));
    StatusSink failing = (snapshot, target) -> {
      throw new IOException("read-only filesystem");
    };
    StatusReporter reporter = new StatusReporter(new StatusAggregator(state), failing, state, Duration.ofSeconds(1));

    assertEquals(SystemStatus.IDLE, reporter.publishOnce().status());
  }

  @Test
  void rejectsNonPositiveInterval() {
    ObservationState state = new ObservationState();
    assertThrows(IllegalArgumentException.class,
        () -> new StatusReporter(new StatusAggregator(state), (s, t) -> { }, state, Duration.ZERO));
  }

  private static final class RecordingSink implements StatusSink {
    private final List<Path> targets = new CopyOnWriteArrayList<>();
    private final CountDownLatch published;

    RecordingSink(int expected) {
      this.published = new CountDownLatch(expected);
    }

    @Override
    public void publish(StatusSnapshot snapshot, Path target) {
      targets.add(target);
      published.countDown();
    }
  }
}
