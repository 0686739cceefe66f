package jobqueue.worker;

import jobqueue.JobOutcome;
import jobqueue.JobPayload;
import jobqueue.JobTimeoutException;
import jobqueue.NonRetryableJobException;
import jobqueue.ProcessingPipeline;
import jobqueue.model.JobClaim;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one claimed attempt: invokes the pipeline, then either finalizes the job or
 * yields the claim for a retry. Shared by {@link WorkerLoop} (retry counter is the
 * message delivery count) and {@link StuckJobReclaimer} (retry counter is the
 * claim's attempt number).
 *
 * <p>Every store write uses its own auto-committed connection.
 */
final class AttemptRunner {
  private static final Logger logger = Logger.getLogger(AttemptRunner.class.getName());

  enum Result {
    /** Finalized COMPLETED or SKIPPED. */
    SUCCEEDED,
    /** Finalized FAILED or TIMED_OUT. */
    FAILED,
    /** Claim yielded; the job should be delivered again. */
    RETRY,
    /** The claim moved on before the outcome could be written. */
    CLAIM_LOST,
    /** The outcome could not be written; the claim stays until it goes stale. */
    STORE_ERROR
  }

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final ProcessingPipeline pipeline;
  private final int maxRetries;
  private final MetricsExporter metrics;
  private final WorkerStats stats;
  private final Clock clock;

  AttemptRunner(ConnectionProvider connectionProvider, JobStore jobStore, ProcessingPipeline pipeline,
      int maxRetries, MetricsExporter metrics, WorkerStats stats, Clock clock) {
    this.connectionProvider = connectionProvider;
    this.jobStore = jobStore;
    this.pipeline = pipeline;
    this.maxRetries = maxRetries;
    this.metrics = metrics;
    this.stats = stats;
    this.clock = clock;
  }

  /**
   * @param payload      decoded payload of the claimed job
   * @param claim        the claim held by this worker
   * @param retryCounter delivery count or attempt number; the job is out of retries
   *                     once it reaches {@code maxRetries}
   * @param messageId    queue message id for logs and status, or {@code null}
   */
  Result run(JobPayload payload, JobClaim claim, int retryCounter, Long messageId) {
    String jobId = claim.jobId();
    long startNanos = System.nanoTime();
    JobOutcome outcome;
    try {
      outcome = pipeline.process(payload, claim);
      if (outcome == null) {
        throw new IllegalStateException("Pipeline returned no outcome");
      }
      if (!(outcome instanceof JobOutcome.Completed) && !(outcome instanceof JobOutcome.Skipped)) {
        throw new IllegalStateException("Pipeline returned " + outcome.status()
            + "; failures must be thrown: " + outcome.detail());
      }
    } catch (NonRetryableJobException e) {
      recordDuration(startNanos);
      String error = describe(e);
      logger.log(Level.WARNING, "Job {0} failed permanently: {1}", new Object[]{jobId, error});
      stats.error(jobId, messageId, error, clock.instant());
      return finish(claim, new JobOutcome.Failed(error));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Job {0} interrupted; releasing claim", jobId);
      yieldClaim(claim, "Interrupted before completion");
      return Result.RETRY;
    } catch (Exception e) {
      recordDuration(startNanos);
      return handleTransientFailure(claim, e, retryCounter, messageId);
    }
    recordDuration(startNanos);
    return finish(claim, outcome);
  }

  private Result handleTransientFailure(JobClaim claim, Exception failure, int retryCounter, Long messageId) {
    String jobId = claim.jobId();
    String error = describe(failure);
    Instant now = clock.instant();
    stats.error(jobId, messageId, error, now);

    if (retryCounter < maxRetries) {
      logger.log(Level.WARNING, "Job {0} attempt {1}/{2} failed, will retry: {3}",
          new Object[]{jobId, retryCounter, maxRetries, error});
      stats.retried.incrementAndGet();
      metrics.incrementRetries();
      yieldClaim(claim, "Retry " + retryCounter + "/" + maxRetries + ": " + error);
      return Result.RETRY;
    }

    String finalError = "Failed after " + retryCounter + " attempts. Last error: " + error;
    logger.log(Level.SEVERE, "Job {0} out of retries ({1}/{2}): {3}",
        new Object[]{jobId, retryCounter, maxRetries, error});
    boolean timedOut = failure instanceof JobTimeoutException || failure instanceof TimeoutException;
    JobOutcome outcome = timedOut ? new JobOutcome.TimedOut(finalError) : new JobOutcome.Failed(finalError);
    return finish(claim, outcome);
  }

  private Result finish(JobClaim claim, JobOutcome outcome) {
    Instant now = clock.instant();
    boolean written;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      written = jobStore.finalize(conn, claim, outcome, now);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to finalize job " + claim.jobId() + " as " + outcome.status(), e);
      stats.error(claim.jobId(), null, "Finalize failed: " + describe(e), now);
      return Result.STORE_ERROR;
    }
    stats.jobFinished(now);
    if (!written) {
      logger.log(Level.WARNING,
          "Claim on job {0} was taken over or the job was reset; discarding {1} outcome",
          new Object[]{claim.jobId(), outcome.status()});
      return Result.CLAIM_LOST;
    }
    switch (outcome.status()) {
      case COMPLETED:
        stats.completed.incrementAndGet();
        metrics.incrementJobsCompleted();
        logger.log(Level.INFO, "Job {0} completed", claim.jobId());
        return Result.SUCCEEDED;
      case SKIPPED:
        stats.completed.incrementAndGet();
        metrics.incrementJobsSkipped();
        logger.log(Level.INFO, "Job {0} skipped: {1}", new Object[]{claim.jobId(), outcome.detail()});
        return Result.SUCCEEDED;
      default:
        stats.failed.incrementAndGet();
        metrics.incrementJobsFailed();
        return Result.FAILED;
    }
  }

  private void yieldClaim(JobClaim claim, String error) {
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (!jobStore.yieldClaim(conn, claim, error, now)) {
        logger.log(Level.FINE, "Claim on job {0} already moved on; nothing to yield", claim.jobId());
      }
    } catch (SQLException | RuntimeException e) {
      // The claim stays in place and goes stale after the threshold.
      logger.log(Level.SEVERE, "Failed to yield claim on job " + claim.jobId(), e);
    }
  }

  private void recordDuration(long startNanos) {
    metrics.recordJobDurationMs(Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L));
  }

  static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }
}
