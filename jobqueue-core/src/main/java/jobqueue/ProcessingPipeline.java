package jobqueue;

import jobqueue.model.JobClaim;

/**
 * Performs the actual work of a job once the worker holds its claim.
 *
 * <p>Return {@link JobOutcome.Completed} or {@link JobOutcome.Skipped} on success.
 * Any other outcome is rejected and counts as a transient failure. Signal failure by throwing:
 * <ul>
 *   <li>{@link NonRetryableJobException}: fail now, no retry
 *   <li>{@link JobTimeoutException} or {@link java.util.concurrent.TimeoutException}: transient,
 *       finalized {@code TIMED_OUT} when retries run out
 *   <li>anything else: transient, finalized {@code FAILED} when retries run out
 * </ul>
 *
 * <p>Implementations must tolerate re-execution: an attempt that outlives the
 * staleness threshold can be taken over and run again by another worker.
 */
@FunctionalInterface
public interface ProcessingPipeline {

  /**
   * @param payload the decoded job payload
   * @param claim   the claim held for this attempt; {@link JobClaim#attempt()} is 1 on the first try
   * @return the terminal outcome
   * @throws Exception on failure, see the class description
   */
  JobOutcome process(JobPayload payload, JobClaim claim) throws Exception;
}
