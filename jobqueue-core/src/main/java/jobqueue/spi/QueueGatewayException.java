package jobqueue.spi;

/**
 * Unchecked exception for failures talking to the message queue.
 */
public class QueueGatewayException extends RuntimeException {
    public QueueGatewayException(String message) {
        super(message);
    }

    public QueueGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
