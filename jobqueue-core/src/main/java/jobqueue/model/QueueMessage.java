package jobqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One delivery of a queue message, as returned by
 * {@link jobqueue.spi.QueueGateway#dequeue}.
 *
 * <p>{@code deliveryCount} is maintained by the queue and starts at 1 on the first
 * delivery; the worker uses it as the retry counter. The worker never persists
 * messages.
 *
 * @param id            delivery handle used to acknowledge the message
 * @param deliveryCount number of times this message has been handed out, including this one
 * @param payloadJson   raw message body
 * @param enqueuedAt    when the message was first enqueued
 * @param visibleAt     when the message becomes visible again if not acknowledged
 */
public record QueueMessage(
    long id,
    int deliveryCount,
    String payloadJson,
    Instant enqueuedAt,
    Instant visibleAt
) {
  public QueueMessage {
    if (deliveryCount < 1) {
      throw new IllegalArgumentException("deliveryCount must be >= 1, got: " + deliveryCount);
    }
    Objects.requireNonNull(payloadJson, "payloadJson");
  }
}
