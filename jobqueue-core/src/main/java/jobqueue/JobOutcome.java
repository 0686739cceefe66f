package jobqueue;

import jobqueue.model.JobStatus;

/**
 * Terminal result of one job attempt, recorded by
 * {@link jobqueue.spi.JobStore#finalize}.
 *
 * <p>Pipelines return {@link Completed} or {@link Skipped}; {@link Failed} and
 * {@link TimedOut} are produced by the worker from pipeline exceptions.
 */
public sealed interface JobOutcome {

  /** The terminal status this outcome writes. */
  JobStatus status();

  /** Text stored in {@code result} (successes) or {@code last_error} (failures). */
  String detail();

  static JobOutcome completed(String resultJson) {
    return new Completed(resultJson);
  }

  static JobOutcome skipped(String reason) {
    return new Skipped(reason);
  }

  /** Work done; {@code resultJson} may be {@code null}. */
  record Completed(String resultJson) implements JobOutcome {
    @Override
    public JobStatus status() {
      return JobStatus.COMPLETED;
    }

    @Override
    public String detail() {
      return resultJson;
    }
  }

  /** Nothing to do for this job (for example, no transcription segments). */
  record Skipped(String reason) implements JobOutcome {
    @Override
    public JobStatus status() {
      return JobStatus.SKIPPED;
    }

    @Override
    public String detail() {
      return reason;
    }
  }

  record Failed(String error) implements JobOutcome {
    @Override
    public JobStatus status() {
      return JobStatus.FAILED;
    }

    @Override
    public String detail() {
      return error;
    }
  }

  record TimedOut(String error) implements JobOutcome {
    @Override
    public JobStatus status() {
      return JobStatus.TIMED_OUT;
    }

    @Override
    public String detail() {
      return error;
    }
  }
}
