package jobqueue.worker;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable counters behind {@link WorkerStatus}. Shared by the loop, the reclaimer
 * and {@link AttemptRunner}.
 */
final class WorkerStats {
  static final int MAX_RECENT_ERRORS = 10;

  final AtomicLong completed = new AtomicLong();
  final AtomicLong failed = new AtomicLong();
  final AtomicLong retried = new AtomicLong();
  final AtomicLong archived = new AtomicLong();
  final AtomicLong redundant = new AtomicLong();
  final AtomicLong reclaimed = new AtomicLong();

  private volatile Instant lastPollAt;
  private volatile Instant lastJobAt;
  private final Deque<WorkerStatus.ErrorEntry> recentErrors = new ArrayDeque<>();

  void polled(Instant at) {
    lastPollAt = at;
  }

  void jobFinished(Instant at) {
    lastJobAt = at;
  }

  void error(String jobId, Long messageId, String error, Instant at) {
    synchronized (recentErrors) {
      recentErrors.addLast(new WorkerStatus.ErrorEntry(jobId, messageId, error, at));
      while (recentErrors.size() > MAX_RECENT_ERRORS) {
        recentErrors.removeFirst();
      }
    }
  }

  WorkerStatus snapshot(boolean running, String ownerId, Instant startedAt, int inFlight) {
    List<WorkerStatus.ErrorEntry> errors;
    synchronized (recentErrors) {
      errors = List.copyOf(recentErrors);
    }
    return new WorkerStatus(running, ownerId, startedAt, inFlight,
        completed.get(), failed.get(), retried.get(), archived.get(),
        redundant.get(), reclaimed.get(), lastPollAt, lastJobAt, errors);
  }
}
