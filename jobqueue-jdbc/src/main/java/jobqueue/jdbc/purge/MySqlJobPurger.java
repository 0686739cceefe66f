package jobqueue.jdbc.purge;

import jobqueue.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * MySQL job purger. Also compatible with TiDB.
 *
 * <p>Overrides with {@code DELETE ... ORDER BY ... LIMIT}; MySQL rejects a
 * {@code LIMIT} inside an {@code IN} subquery on the same table.
 */
public final class MySqlJobPurger extends AbstractJdbcJobPurger {

  public MySqlJobPurger() {
    super();
  }

  public MySqlJobPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN +
        " AND COALESCE(finished_at, updated_at) < ?" +
        " ORDER BY finished_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }
}
