package jobqueue.jdbc.store;

import jobqueue.JobPayload;
import jobqueue.jdbc.JdbcTemplate;
import jobqueue.model.JobClaim;
import jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL job store.
 *
 * <p>Registers jobs with {@code ON CONFLICT DO NOTHING}, so a duplicate never aborts the
 * caller's transaction, and claims with {@code UPDATE ... RETURNING} in a single
 * round-trip.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tableName) {
    super(tableName);
  }

  public PostgresJobStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new PostgresJobStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean registerIfAbsent(Connection conn, JobPayload payload, Instant now) {
    return JdbcTemplate.update(conn, insertSql("INSERT INTO", " ON CONFLICT (job_id) DO NOTHING"),
        insertParams(payload, now)) > 0;
  }

  @Override
  public Optional<JobClaim> claim(Connection conn, String jobId, String ownerId, Instant now,
      Duration stalenessThreshold) {
    Objects.requireNonNull(ownerId, "ownerId");
    Instant nowMs = millis(now);
    String token = newClaimToken();
    String sql = "UPDATE " + tableName() +
        " SET status=" + CLAIMED + ", claim_token=?, claimed_by=?, claimed_at=?, claim_yielded=FALSE," +
        " attempt_count=attempt_count+1, updated_at=?" +
        " WHERE job_id=? AND " + CLAIMABLE +
        " RETURNING attempt_count";
    List<Integer> attempts = JdbcTemplate.updateReturning(conn, sql, rs -> rs.getInt(1),
        token, ownerId, Timestamp.from(nowMs), Timestamp.from(nowMs),
        jobId, Timestamp.from(nowMs.minus(stalenessThreshold)));
    if (attempts.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new JobClaim(jobId, token, ownerId, nowMs, attempts.get(0)));
  }
}
