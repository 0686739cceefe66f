package jobqueue.jdbc.store;

import jobqueue.JobPayload;
import jobqueue.jdbc.JdbcTemplate;
import jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>Registers jobs with {@code INSERT IGNORE}. The claim is the default single-row
 * conditional {@code UPDATE} followed by a {@code SELECT} on the fresh claim token,
 * which stays exclusive under concurrent workers because only one {@code UPDATE} can
 * match the claimable predicate.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String tableName) {
    super(tableName);
  }

  public MySqlJobStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new MySqlJobStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean registerIfAbsent(Connection conn, JobPayload payload, Instant now) {
    return JdbcTemplate.update(conn, insertSql("INSERT IGNORE INTO", ""), insertParams(payload, now)) > 0;
  }
}
