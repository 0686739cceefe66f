package jobqueue;

import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.QueueGateway;
import jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Producer side: registers a job record and enqueues its message.
 *
 * <p>The record is written first, so a message never refers to a job the store
 * does not know. If the send fails the record stays UNCLAIMED and a
 * {@link jobqueue.worker.StuckJobReclaimer} can still pick it up.
 */
public final class JobSubmitter {
  private static final Logger logger = Logger.getLogger(JobSubmitter.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final QueueGateway queueGateway;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public JobSubmitter(ConnectionProvider connectionProvider, JobStore jobStore, QueueGateway queueGateway) {
    this(connectionProvider, jobStore, queueGateway, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JobSubmitter(ConnectionProvider connectionProvider, JobStore jobStore, QueueGateway queueGateway,
      JsonCodec jsonCodec, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    this.queueGateway = Objects.requireNonNull(queueGateway, "queueGateway");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Submits a job for immediate processing.
   *
   * @return the queue message id
   */
  public long submit(JobPayload payload) {
    return submit(payload, Duration.ZERO);
  }

  /**
   * Submits a job whose message becomes visible after {@code delay}.
   *
   * @param payload the job
   * @param delay   initial invisibility of the message
   * @return the queue message id
   * @throws IllegalStateException                if the job record cannot be written
   * @throws jobqueue.spi.QueueGatewayException if the message cannot be sent
   */
  public long submit(JobPayload payload, Duration delay) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(delay, "delay");
    boolean created;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      created = jobStore.registerIfAbsent(conn, payload, clock.instant());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to register job " + payload.jobId(), e);
    }
    long messageId = queueGateway.send(payload.toJson(jsonCodec), delay);
    logger.log(Level.FINE, "Submitted job {0} as message {1} (new record: {2})",
        new Object[]{payload.jobId(), messageId, created});
    return messageId;
  }
}
