package jobqueue.jdbc.purge;

/**
 * PostgreSQL job purger.
 *
 * <p>Uses the default subquery-based purge from {@link AbstractJdbcJobPurger}.
 */
public final class PostgresJobPurger extends AbstractJdbcJobPurger {

  public PostgresJobPurger() {
    super();
  }

  public PostgresJobPurger(String tableName) {
    super(tableName);
  }
}
