package jobqueue;

/**
 * Thrown by a {@link ProcessingPipeline} when retrying cannot help (missing source
 * record, unsupported media, invalid input). The job is finalized {@code FAILED}
 * on the first occurrence and its message archived, regardless of the remaining
 * retry budget.
 */
public class NonRetryableJobException extends RuntimeException {

  public NonRetryableJobException(String message) {
    super(message);
  }

  public NonRetryableJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
