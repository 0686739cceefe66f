package jobqueue.spi;

import jobqueue.model.QueueMessage;

import java.time.Duration;
import java.util.List;

/**
 * Contract with the external message queue.
 *
 * <p>The queue guarantees at-least-once delivery: a dequeued message becomes
 * invisible for the visibility timeout and reappears, with its delivery count
 * incremented, unless it is acknowledged first. The worker only ever acknowledges
 * a message after the job state it depends on has been persisted.
 *
 * <p>Implementations report transport failures with {@link QueueGatewayException}.
 *
 * @see jobqueue.jdbc.queue.PgmqQueueGateway
 */
public interface QueueGateway {

    /**
     * Receives up to {@code maxCount} visible messages and hides them for {@code visibility}.
     *
     * @param visibility how long the returned messages stay invisible to other consumers
     * @param maxCount   maximum number of messages to return (&gt; 0)
     * @return received messages; empty when the queue has nothing visible, never {@code null}
     * @throws QueueGatewayException if the queue cannot be reached
     */
    List<QueueMessage> dequeue(Duration visibility, int maxCount);

    /**
     * Permanently removes a message. Removing an already removed message is a no-op.
     *
     * @param messageId the delivery handle from {@link QueueMessage#id()}
     * @throws QueueGatewayException if the queue cannot be reached
     */
    void ackDelete(long messageId);

    /**
     * Moves a message to the queue's archive for later inspection. Archiving an
     * already archived or deleted message is a no-op.
     *
     * @param messageId the delivery handle from {@link QueueMessage#id()}
     * @throws QueueGatewayException if the queue cannot be reached
     */
    void ackArchive(long messageId);

    /**
     * Enqueues a new message.
     *
     * <p>Optional operation used by producers. The default throws
     * {@link UnsupportedOperationException}.
     *
     * @param payloadJson message body
     * @param delay       how long before the message first becomes visible ({@link Duration#ZERO} for now)
     * @return the id of the new message
     * @throws QueueGatewayException if the queue cannot be reached
     */
    default long send(String payloadJson, Duration delay) {
        throw new UnsupportedOperationException("send is not supported by " + getClass().getName());
    }
}
