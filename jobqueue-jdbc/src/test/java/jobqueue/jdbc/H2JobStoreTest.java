package jobqueue.jdbc;

import jobqueue.jdbc.purge.AbstractJdbcJobPurger;
import jobqueue.jdbc.purge.H2JobPurger;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.H2JobStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.UUID;

class H2JobStoreTest extends AbstractJobStoreIntegrationTest {
  private final H2JobStore store = new H2JobStore();
  private final H2JobPurger purger = new H2JobPurger();
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection()) {
      Schemas.apply(conn, "/schema/h2.sql");
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcJobStore store() {
    return store;
  }

  @Override
  AbstractJdbcJobPurger purger() {
    return purger;
  }
}
