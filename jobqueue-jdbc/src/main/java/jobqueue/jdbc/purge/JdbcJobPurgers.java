package jobqueue.jdbc.purge;

import java.util.Locale;

/**
 * Picks the purger matching a job store name from
 * {@link jobqueue.jdbc.store.AbstractJdbcJobStore#name()}.
 */
public final class JdbcJobPurgers {

  private JdbcJobPurgers() {
  }

  /**
   * @param storeName "h2", "mysql" or "postgresql"
   * @param tableName the job table
   * @throws IllegalArgumentException for an unknown name
   */
  public static AbstractJdbcJobPurger forStore(String storeName, String tableName) {
    switch (storeName.toLowerCase(Locale.ROOT)) {
      case "h2":
        return new H2JobPurger(tableName);
      case "mysql":
        return new MySqlJobPurger(tableName);
      case "postgresql":
        return new PostgresJobPurger(tableName);
      default:
        throw new IllegalArgumentException("No purger for job store: " + storeName);
    }
  }
}
