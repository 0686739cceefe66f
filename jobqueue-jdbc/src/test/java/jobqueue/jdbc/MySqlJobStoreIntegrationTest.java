package jobqueue.jdbc;

import jobqueue.jdbc.purge.AbstractJdbcJobPurger;
import jobqueue.jdbc.purge.MySqlJobPurger;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.MySqlJobStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;

@DockerAvailable
@Testcontainers
class MySqlJobStoreIntegrationTest extends AbstractJobStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("jobqueue_test");

  private static final MySqlJobStore STORE = new MySqlJobStore();
  private static final MySqlJobPurger PURGER = new MySqlJobPurger();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    try (Connection conn = dataSource.getConnection()) {
      Schemas.apply(conn, "/schema/mysql.sql");
    }
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("TRUNCATE TABLE job_record");
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcJobStore store() {
    return STORE;
  }

  @Override
  AbstractJdbcJobPurger purger() {
    return PURGER;
  }
}
