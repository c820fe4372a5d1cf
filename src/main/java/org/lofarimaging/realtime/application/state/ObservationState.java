package org.lofarimaging.realtime.application.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.lofarimaging.realtime.domain.block.SubbandRange;
import org.lofarimaging.realtime.domain.observation.ObservationSession;
import org.lofarimaging.realtime.domain.status.ImageLogEntry;
import org.lofarimaging.realtime.domain.status.ProcessingTimeWindow;
import org.lofarimaging.realtime.domain.status.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Single owner of the live observation state shared by the control surface, the producer
 * loop, render workers, and status readers.
 * <p><strong>Why:</strong> Keeps the pending counter, processing-time window, image log, and progress fields
 * consistent with each other under one lock, instead of scattering them as globals.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Admit at most one observation at a time and hand out its {@link CancellationToken}.</li>
 *   <li>Count in-flight render tasks; the counter never goes below zero.</li>
 *   <li>Record render completions and the image log.</li>
 *   <li>Produce lock-scoped copies for the status aggregator.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All mutable fields except the observing flag are guarded by one
 * {@link ReentrantLock}, always released in {@code finally}. The tracking history has its own lock and is never
 * touched while this lock is held.</p>
 *
 * @since 0.1.0
 */
public final class ObservationState {
  private static final Logger log = LoggerFactory.getLogger(ObservationState.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final TrackingHistory trackingHistory = new TrackingHistory();

  private volatile boolean observing;

  // guarded by lock
  private CancellationToken token = new CancellationToken();
  private SystemStatus status = SystemStatus.IDLE;
  private int pendingTasks;
  private final ProcessingTimeWindow processingTimes = new ProcessingTimeWindow();
  private final List<ImageLogEntry> imageLog = new ArrayList<>();
  private Long lastBlockNumber;
  private Integer lastSubband;
  private String currentFile;
  private SubbandRange subbandRange;
  private ObservationSession session;
  private RunParameters runParameters = RunParameters.NONE;

  /**
   * Admits a new observation unless one is already running or renders of the previous one are still in flight.
   * Those renders would otherwise log their images into the new observation.
   *
   * @param parameters run configuration shown in status output
   * @return the new observation's token, or empty when refused
   */
  public Optional<CancellationToken> tryBegin(RunParameters parameters) {
    Objects.requireNonNull(parameters, "parameters");
    CancellationToken issued;
    lock.lock();
    try {
      if (observing) {
        return Optional.empty();
      }
      if (pendingTasks > 0) {
        log.warn("{} renders of the previous observation are still running; refusing to start", pendingTasks);
        return Optional.empty();
      }
      observing = true;
      token = new CancellationToken();
      issued = token;
      status = SystemStatus.RUNNING;
      runParameters = parameters;
      lastBlockNumber = null;
      lastSubband = null;
      currentFile = null;
      subbandRange = null;
      session = null;
      processingTimes.clear();
      imageLog.clear();
    } finally {
      lock.unlock();
    }
    trackingHistory.clear();
    return Optional.of(issued);
  }

  /**
   * Requests the active observation to stop: cancels its token, clears the observing flag, and reports
   * {@link SystemStatus#STOPPING}.
   *
   * @return {@code true} if an observation was active
   */
  public boolean requestStop() {
    lock.lock();
    try {
      if (!observing) {
        return false;
      }
      token.cancel();
      observing = false;
      status = SystemStatus.STOPPING;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Marks the observation finished and the system idle. */
  public void finish() {
    lock.lock();
    try {
      observing = false;
      token.cancel();
      status = SystemStatus.IDLE;
    } finally {
      lock.unlock();
    }
  }

  public boolean isObserving() {
    return observing;
  }

  public CancellationToken currentToken() {
    lock.lock();
    try {
      return token;
    } finally {
      lock.unlock();
    }
  }

  public void setStatus(SystemStatus newStatus) {
    Objects.requireNonNull(newStatus, "newStatus");
    lock.lock();
    try {
      status = newStatus;
    } finally {
      lock.unlock();
    }
  }

  public SystemStatus status() {
    lock.lock();
    try {
      return status;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Attaches the session and empties the image log.
   *
   * @param newSession session created for the current observation
   */
  public void attachSession(ObservationSession newSession) {
    Objects.requireNonNull(newSession, "newSession");
    lock.lock();
    try {
      session = newSession;
      imageLog.clear();
    } finally {
      lock.unlock();
    }
  }

  public Optional<ObservationSession> session() {
    lock.lock();
    try {
      return Optional.ofNullable(session);
    } finally {
      lock.unlock();
    }
  }

  public void setCurrentFile(String file) {
    lock.lock();
    try {
      currentFile = file;
    } finally {
      lock.unlock();
    }
  }

  public void setSubbandRange(SubbandRange range) {
    lock.lock();
    try {
      subbandRange = range;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records the block just read from the stream.
   *
   * @param blockNumber one-based number of the block, equal to the count of blocks read so far
   */
  public void recordBlockRead(long blockNumber) {
    lock.lock();
    try {
      lastBlockNumber = blockNumber;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts a task about to be submitted.
   *
   * @return pending count after the increment
   */
  public int incrementPending() {
    lock.lock();
    try {
      return ++pendingTasks;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts a task that finished, failed, was cancelled, or was refused by the pool.
   *
   * @return pending count after the decrement
   */
  public int decrementPending() {
    lock.lock();
    try {
      if (pendingTasks == 0) {
        log.warn("Pending render counter already at zero; ignoring decrement");
        return 0;
      }
      return --pendingTasks;
    } finally {
      lock.unlock();
    }
  }

  public int pendingCount() {
    lock.lock();
    try {
      return pendingTasks;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records a completed render.
   *
   * @param durationSeconds render wall time
   * @param entry image log entry when a near-field image was produced
   */
  public void recordCompletion(double durationSeconds, ImageLogEntry entry) {
    lock.lock();
    try {
      processingTimes.record(durationSeconds);
      if (entry != null) {
        imageLog.add(entry);
        lastSubband = entry.subband();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Copy of the image log in append order. */
  public List<ImageLogEntry> imageLog() {
    lock.lock();
    try {
      return List.copyOf(imageLog);
    } finally {
      lock.unlock();
    }
  }

  public TrackingHistory trackingHistory() {
    return trackingHistory;
  }

  /**
   * Copies every field the status aggregator reads, under the state lock only.
   *
   * @return immutable view
   */
  public View view() {
    lock.lock();
    try {
      return new View(
          status,
          lastBlockNumber,
          lastSubband,
          pendingTasks,
          processingTimes.average(),
          currentFile,
          subbandRange,
          runParameters);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lock-free copy of the state fields.
   *
   * @param status lifecycle status
   * @param lastBlockNumber one-based number of the last block read
   * @param lastSubband subband of the last logged image
   * @param pendingCount in-flight render tasks
   * @param averageProcessingSeconds unrounded mean render time over the window
   * @param currentFile stream file being tailed
   * @param subbandRange resolved subband range
   * @param runParameters run configuration
   */
  public record View(
      SystemStatus status,
      Long lastBlockNumber,
      Integer lastSubband,
      int pendingCount,
      double averageProcessingSeconds,
      String currentFile,
      SubbandRange subbandRange,
      RunParameters runParameters) {}
}
