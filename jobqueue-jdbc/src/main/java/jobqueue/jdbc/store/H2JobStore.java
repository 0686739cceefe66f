package jobqueue.jdbc.store;

import jobqueue.util.JsonCodec;

import java.util.List;

/**
 * H2 job store. Primarily for testing.
 *
 * <p>Uses the default insert-and-catch registration and two-step claim from
 * {@link AbstractJdbcJobStore}.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String tableName) {
    super(tableName);
  }

  public H2JobStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new H2JobStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
