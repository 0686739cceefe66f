package jobqueue.worker;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time snapshot of a worker's activity, for health and status endpoints.
 *
 * @param running      whether the loop has been started and not closed
 * @param ownerId      identity the worker claims jobs with
 * @param startedAt    when {@code start()} was called, or {@code null}
 * @param inFlight     attempts currently executing
 * @param completed    jobs finalized COMPLETED or SKIPPED
 * @param failed       jobs finalized FAILED or TIMED_OUT
 * @param retried      failed attempts left for redelivery
 * @param archived     messages moved to the archive
 * @param redundant    deliveries dropped because another worker owns or finished the job
 * @param reclaimed    jobs taken over by the reclaimer
 * @param lastPollAt   last successful dequeue, or {@code null}
 * @param lastJobAt    last finished attempt, or {@code null}
 * @param recentErrors most recent errors, newest last
 */
public record WorkerStatus(
    boolean running,
    String ownerId,
    Instant startedAt,
    int inFlight,
    long completed,
    long failed,
    long retried,
    long archived,
    long redundant,
    long reclaimed,
    Instant lastPollAt,
    Instant lastJobAt,
    List<ErrorEntry> recentErrors
) {

  /**
   * One recorded error.
   *
   * @param jobId     job id, or {@code null} if the payload could not be decoded
   * @param messageId queue message id, or {@code null} for reclaimed jobs
   * @param error     error message
   * @param at        when it happened
   */
  public record ErrorEntry(String jobId, Long messageId, String error, Instant at) {}
}
