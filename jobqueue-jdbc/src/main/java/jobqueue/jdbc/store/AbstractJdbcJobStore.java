package jobqueue.jdbc.store;

import com.github.f4b6a3.ulid.UlidCreator;
import jobqueue.JobOutcome;
import jobqueue.JobPayload;
import jobqueue.jdbc.JdbcTemplate;
import jobqueue.jdbc.JobStoreException;
import jobqueue.jdbc.TableNames;
import jobqueue.model.JobClaim;
import jobqueue.model.JobKind;
import jobqueue.model.JobRecord;
import jobqueue.model.JobStatus;
import jobqueue.spi.JobStore;
import jobqueue.spi.StuckJobScanner;
import jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Every state change is a single conditional {@code UPDATE}; the row count tells
 * the caller whether it won. The claim token written by {@link #claim} guards
 * {@link #finalize} and {@link #yieldClaim}, so an attempt whose claim was taken over
 * can never overwrite the newer attempt's state.
 *
 * <p>Subclasses override {@link #registerIfAbsent} and {@link #claim} where the database
 * offers better syntax. Register custom implementations via
 * {@code META-INF/services/jobqueue.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore, StuckJobScanner {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final int UNCLAIMED = JobStatus.UNCLAIMED.code();
  protected static final int CLAIMED = JobStatus.CLAIMED.code();

  protected static final String RECORD_COLUMNS =
      "job_id, job_kind, payload, status, attempt_count, claimed_by, claimed_at, claim_yielded, " +
      "result, last_error, completed_count, created_at, updated_at, finished_at";

  protected static final JdbcTemplate.RowMapper<JobRecord> RECORD_ROW_MAPPER = rs -> new JobRecord(
      rs.getString("job_id"),
      JobKind.fromWireName(rs.getString("job_kind")),
      rs.getString("payload"),
      JobStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempt_count"),
      rs.getString("claimed_by"),
      toInstant(rs, "claimed_at"),
      rs.getBoolean("claim_yielded"),
      rs.getString("result"),
      rs.getString("last_error"),
      rs.getInt("completed_count"),
      toInstant(rs, "created_at"),
      toInstant(rs, "updated_at"),
      toInstant(rs, "finished_at"));

  /** Claimable now: never claimed, claim gone stale, or claim yielded for a retry. */
  protected static final String CLAIMABLE =
      "(status=" + UNCLAIMED + " OR (status=" + CLAIMED + " AND (claimed_at < ? OR claim_yielded=TRUE)))";

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcJobStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcJobStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcJobStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   */
  public abstract AbstractJdbcJobStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * Plain insert; a duplicate key means the record already exists. Works on H2 and
   * any database that does not poison the transaction on a constraint violation.
   */
  @Override
  public boolean registerIfAbsent(Connection conn, JobPayload payload, Instant now) {
    try {
      return JdbcTemplate.update(conn, insertSql("INSERT INTO", ""), insertParams(payload, now)) > 0;
    } catch (JobStoreException e) {
      if (JdbcTemplate.isIntegrityViolation(e)) {
        return false;
      }
      throw e;
    }
  }

  protected String insertSql(String insertPrefix, String suffix) {
    return insertPrefix + " " + tableName() + " (" +
        "job_id, job_kind, payload, status, attempt_count, claim_yielded, completed_count, " +
        "created_at, updated_at" +
        ") VALUES (?,?,?," + UNCLAIMED + ",0,FALSE,0,?,?)" + suffix;
  }

  protected Object[] insertParams(JobPayload payload, Instant now) {
    Timestamp ts = Timestamp.from(millis(now));
    return new Object[]{payload.jobId(), payload.kind().wireName(), payload.toJson(jsonCodec), ts, ts};
  }

  /**
   * Conditional claim followed by a read of the new attempt number, matched on the
   * fresh token so a concurrent takeover in between is reported as a lost claim.
   */
  @Override
  public Optional<JobClaim> claim(Connection conn, String jobId, String ownerId, Instant now,
      Duration stalenessThreshold) {
    Objects.requireNonNull(ownerId, "ownerId");
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = millis(now);
    String token = newClaimToken();
    String sql = "UPDATE " + tableName() +
        " SET status=" + CLAIMED + ", claim_token=?, claimed_by=?, claimed_at=?, claim_yielded=FALSE," +
        " attempt_count=attempt_count+1, updated_at=?" +
        " WHERE job_id=? AND " + CLAIMABLE;
    int updated = JdbcTemplate.update(conn, sql,
        token, ownerId, Timestamp.from(nowMs), Timestamp.from(nowMs),
        jobId, Timestamp.from(nowMs.minus(stalenessThreshold)));
    if (updated == 0) {
      return Optional.empty();
    }
    List<Integer> attempts = JdbcTemplate.query(conn,
        "SELECT attempt_count FROM " + tableName() + " WHERE job_id=? AND claim_token=?",
        rs -> rs.getInt(1), jobId, token);
    if (attempts.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new JobClaim(jobId, token, ownerId, nowMs, attempts.get(0)));
  }

  @Override
  public boolean finalize(Connection conn, JobClaim claim, JobOutcome outcome, Instant now) {
    JobStatus status = outcome.status();
    if (status == JobStatus.CLAIMED || !JobStatus.CLAIMED.canTransitionTo(status)) {
      throw new IllegalArgumentException("Cannot finalize a claimed job as " + status);
    }
    Timestamp ts = Timestamp.from(millis(now));
    String where = " WHERE job_id=? AND status=" + CLAIMED + " AND claim_token=?";
    if (status == JobStatus.COMPLETED || status == JobStatus.SKIPPED) {
      String sql = "UPDATE " + tableName() +
          " SET status=?, result=?, completed_count=completed_count+1, last_completed_at=?," +
          " finished_at=?, updated_at=?, claim_token=NULL, claim_yielded=FALSE" + where;
      return JdbcTemplate.update(conn, sql,
          status.code(), outcome.detail(), ts, ts, ts, claim.jobId(), claim.token()) > 0;
    }
    String sql = "UPDATE " + tableName() +
        " SET status=?, last_error=?, finished_at=?, updated_at=?, claim_token=NULL, claim_yielded=FALSE" + where;
    return JdbcTemplate.update(conn, sql,
        status.code(), truncateError(outcome.detail()), ts, ts, claim.jobId(), claim.token()) > 0;
  }

  @Override
  public boolean yieldClaim(Connection conn, JobClaim claim, String error, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET claim_yielded=TRUE, last_error=?, updated_at=?" +
        " WHERE job_id=? AND status=" + CLAIMED + " AND claim_token=?";
    return JdbcTemplate.update(conn, sql,
        truncateError(error), Timestamp.from(millis(now)), claim.jobId(), claim.token()) > 0;
  }

  @Override
  public boolean reset(Connection conn, String jobId, boolean preserveHistory, Instant now) {
    String history = preserveHistory ? "" : ", result=NULL, completed_count=0, last_completed_at=NULL";
    String sql = "UPDATE " + tableName() +
        " SET status=" + UNCLAIMED + ", attempt_count=0, claim_token=NULL, claimed_by=NULL," +
        " claimed_at=NULL, claim_yielded=FALSE, last_error=NULL, finished_at=NULL, updated_at=?" +
        history + " WHERE job_id=?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(millis(now)), jobId) > 0;
  }

  @Override
  public Optional<JobRecord> find(Connection conn, String jobId) {
    String sql = "SELECT " + RECORD_COLUMNS + " FROM " + tableName() + " WHERE job_id=?";
    List<JobRecord> rows = JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, jobId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<JobRecord> queryByStatus(Connection conn, JobStatus status, int limit) {
    if (status == null) {
      String sql = "SELECT " + RECORD_COLUMNS + " FROM " + tableName() +
          " ORDER BY created_at, job_id LIMIT ?";
      return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, limit);
    }
    String sql = "SELECT " + RECORD_COLUMNS + " FROM " + tableName() +
        " WHERE status=? ORDER BY created_at, job_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, status.code(), limit);
  }

  @Override
  public int countByStatus(Connection conn, JobStatus status) {
    List<Integer> counts = status == null
        ? JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName(), rs -> rs.getInt(1))
        : JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName() + " WHERE status=?",
            rs -> rs.getInt(1), status.code());
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  @Override
  public List<String> findReclaimable(Connection conn, Instant now, Duration stalenessThreshold,
      Duration skipRecent, int limit) {
    Timestamp recentCutoff = Timestamp.from(skipRecent == null ? now : now.minus(skipRecent));
    String sql = "SELECT job_id FROM " + tableName() +
        " WHERE (status=" + UNCLAIMED + " AND created_at <= ?)" +
        " OR (status=" + CLAIMED + " AND claimed_at < ?)" +
        " OR (status=" + CLAIMED + " AND claim_yielded=TRUE AND updated_at <= ?)" +
        " ORDER BY created_at, job_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString(1),
        recentCutoff, Timestamp.from(now.minus(stalenessThreshold)), recentCutoff, limit);
  }

  protected static Instant millis(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS);
  }

  /** Claim tokens are monotonic ULIDs, unique across workers. */
  protected static String newClaimToken() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  private static Instant toInstant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
