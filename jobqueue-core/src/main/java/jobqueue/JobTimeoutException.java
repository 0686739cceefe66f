package jobqueue;

import java.time.Duration;

/**
 * Thrown by a {@link ProcessingPipeline} when a step exceeded its time limit.
 *
 * <p>Timeouts are retried like any transient failure. When the retry budget is
 * exhausted the job is finalized {@code TIMED_OUT} instead of {@code FAILED}.
 */
public class JobTimeoutException extends RuntimeException {

  private final Duration limit;

  public JobTimeoutException(String message, Duration limit) {
    super(message);
    this.limit = limit;
  }

  public JobTimeoutException(String message, Duration limit, Throwable cause) {
    super(message, cause);
    this.limit = limit;
  }

  /** The exceeded limit, or {@code null} if unknown. */
  public Duration limit() {
    return limit;
  }
}
