package jobqueue.jdbc.purge;

/**
 * H2 job purger. Uses the default subquery-based purge.
 */
public final class H2JobPurger extends AbstractJdbcJobPurger {

  public H2JobPurger() {
    super();
  }

  public H2JobPurger(String tableName) {
    super(tableName);
  }
}
