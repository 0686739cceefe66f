package jobqueue.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the job stores and purgers.
 */
public final class JobStoreException extends RuntimeException {
  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
