package jobqueue.jdbc.purge;

import jobqueue.jdbc.JdbcTemplate;
import jobqueue.jdbc.TableNames;
import jobqueue.model.JobStatus;
import jobqueue.spi.JobPurger;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Base JDBC job purger with default subquery-based SQL that works for H2
 * and PostgreSQL.
 *
 * <p>Only finished jobs are deleted; UNCLAIMED and CLAIMED records are never touched.
 * Subclasses may override {@link #purge} for databases that support more
 * efficient syntax (e.g. MySQL supports {@code DELETE ... ORDER BY ... LIMIT}).
 *
 * @see H2JobPurger
 * @see MySqlJobPurger
 * @see PostgresJobPurger
 */
public abstract class AbstractJdbcJobPurger implements JobPurger {

  protected static final String TERMINAL_STATUS_IN = "(" +
      JobStatus.COMPLETED.code() + "," + JobStatus.SKIPPED.code() + "," +
      JobStatus.FAILED.code() + "," + JobStatus.TIMED_OUT.code() + ")";

  private final String tableName;

  protected AbstractJdbcJobPurger() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcJobPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  /**
   * Deletes finished jobs whose {@code finished_at} is older than {@code before},
   * up to {@code limit} rows.
   */
  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE job_id IN (" +
        "SELECT job_id FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN +
        " AND COALESCE(finished_at, updated_at) < ?" +
        " ORDER BY finished_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }
}
