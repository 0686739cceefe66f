package jobqueue;

/**
 * Thrown by {@link PayloadDecoder} when a message body cannot become a {@link JobPayload}.
 * Such messages are archived without consuming a retry.
 */
public class MalformedPayloadException extends RuntimeException {

  public MalformedPayloadException(String message) {
    super(message);
  }

  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
