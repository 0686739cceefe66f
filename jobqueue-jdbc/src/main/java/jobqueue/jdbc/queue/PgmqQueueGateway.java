package jobqueue.jdbc.queue;

import jobqueue.jdbc.JdbcTemplate;
import jobqueue.jdbc.JobStoreException;
import jobqueue.model.QueueMessage;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.QueueGateway;
import jobqueue.spi.QueueGatewayException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link QueueGateway} over the <a href="https://github.com/pgmq/pgmq">pgmq</a> PostgreSQL
 * extension.
 *
 * <p>Maps {@code pgmq.read} to {@link #dequeue}, with {@code read_ct} as the delivery
 * count and {@code vt} as the visible-at instant, and {@code pgmq.delete},
 * {@code pgmq.archive} and {@code pgmq.send} to the acknowledgement and send operations.
 * Every call runs on its own auto-committed connection.
 */
public final class PgmqQueueGateway implements QueueGateway {
  private static final Logger logger = Logger.getLogger(PgmqQueueGateway.class.getName());
  private static final String QUEUE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private static final JdbcTemplate.RowMapper<QueueMessage> MESSAGE_ROW_MAPPER = rs -> new QueueMessage(
      rs.getLong("msg_id"),
      rs.getInt("read_ct"),
      rs.getString("message"),
      toInstant(rs.getTimestamp("enqueued_at")),
      toInstant(rs.getTimestamp("vt")));

  private final ConnectionProvider connectionProvider;
  private final String queueName;

  public PgmqQueueGateway(ConnectionProvider connectionProvider, String queueName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(queueName, "queueName");
    if (!queueName.matches(QUEUE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid queue name: " + queueName);
    }
    this.queueName = queueName;
  }

  public String queueName() {
    return queueName;
  }

  /** Creates the queue and its archive table if they do not exist yet. */
  public void createQueue() {
    try (Connection conn = open()) {
      JdbcTemplate.query(conn, "SELECT pgmq.create(?)", rs -> Boolean.TRUE, queueName);
      logger.log(Level.INFO, "pgmq queue {0} ready", queueName);
    } catch (SQLException | JobStoreException e) {
      throw new QueueGatewayException("Failed to create queue " + queueName, e);
    }
  }

  @Override
  public List<QueueMessage> dequeue(Duration visibility, int maxCount) {
    if (maxCount <= 0) {
      throw new IllegalArgumentException("maxCount must be > 0");
    }
    int vtSeconds = (int) Math.max(1L, visibility.toSeconds());
    String sql = "SELECT msg_id, read_ct, enqueued_at, vt, message::text AS message FROM pgmq.read(?, ?, ?)";
    try (Connection conn = open()) {
      return JdbcTemplate.query(conn, sql, MESSAGE_ROW_MAPPER, queueName, vtSeconds, maxCount);
    } catch (SQLException | JobStoreException e) {
      throw new QueueGatewayException("Failed to read from queue " + queueName, e);
    }
  }

  /** Deletes the message. A message that is already gone is not an error. */
  @Override
  public void ackDelete(long messageId) {
    if (!call("SELECT pgmq.delete(?, ?)", messageId, "delete")) {
      logger.log(Level.FINE, "Message {0} was already gone from {1}", new Object[]{messageId, queueName});
    }
  }

  /** Moves the message to the queue's archive table. A message that is already gone is not an error. */
  @Override
  public void ackArchive(long messageId) {
    if (!call("SELECT pgmq.archive(?, ?)", messageId, "archive")) {
      logger.log(Level.FINE, "Message {0} was already gone from {1}", new Object[]{messageId, queueName});
    }
  }

  @Override
  public long send(String payloadJson, Duration delay) {
    Objects.requireNonNull(payloadJson, "payloadJson");
    int delaySeconds = (int) Math.max(0L, delay.toSeconds());
    try (Connection conn = open()) {
      List<Long> ids = JdbcTemplate.query(conn, "SELECT * FROM pgmq.send(?, ?::jsonb, ?)",
          rs -> rs.getLong(1), queueName, payloadJson, delaySeconds);
      if (ids.isEmpty()) {
        throw new QueueGatewayException("pgmq.send returned no message id");
      }
      return ids.get(0);
    } catch (SQLException | JobStoreException e) {
      throw new QueueGatewayException("Failed to send to queue " + queueName, e);
    }
  }

  private boolean call(String sql, long messageId, String action) {
    try (Connection conn = open()) {
      List<Boolean> result = JdbcTemplate.query(conn, sql, rs -> rs.getBoolean(1), queueName, messageId);
      return !result.isEmpty() && result.get(0);
    } catch (SQLException | JobStoreException e) {
      throw new QueueGatewayException("Failed to " + action + " message " + messageId + " in " + queueName, e);
    }
  }

  private Connection open() throws SQLException {
    Connection conn = connectionProvider.getConnection();
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      conn.close();
      throw e;
    }
    return conn;
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }
}
