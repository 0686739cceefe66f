package jobqueue.model;

/**
 * Lifecycle status of a persisted job record.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>{@code UNCLAIMED -> CLAIMED}
 *   <li>{@code CLAIMED -> CLAIMED} (stale takeover, or re-claim after a yielded attempt)
 *   <li>{@code CLAIMED -> COMPLETED | SKIPPED | FAILED | TIMED_OUT}
 *   <li>any status {@code -> UNCLAIMED}, only through an operator reset
 * </ul>
 */
public enum JobStatus {
  UNCLAIMED(0),
  CLAIMED(1),
  COMPLETED(2),
  SKIPPED(3),
  FAILED(4),
  TIMED_OUT(5);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Terminal statuses are only left through an operator reset. */
  public boolean isTerminal() {
    return this == COMPLETED || this == SKIPPED || this == FAILED || this == TIMED_OUT;
  }

  /**
   * Returns whether the worker may move a record from this status to {@code next}.
   * Operator resets are not covered here; they are allowed from any status.
   */
  public boolean canTransitionTo(JobStatus next) {
    if (next == null) {
      return false;
    }
    switch (this) {
      case UNCLAIMED:
        return next == CLAIMED;
      case CLAIMED:
        return next == CLAIMED || next.isTerminal();
      default:
        return false;
    }
  }

  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }
}
