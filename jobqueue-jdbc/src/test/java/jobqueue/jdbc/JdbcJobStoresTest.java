package jobqueue.jdbc;

import jobqueue.jdbc.purge.JdbcJobPurgers;
import jobqueue.jdbc.purge.MySqlJobPurger;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.JdbcJobStores;
import jobqueue.jdbc.store.PostgresJobStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoresTest {

  @Test
  void allReturnsBuiltInStores() {
    List<AbstractJdbcJobStore> stores = JdbcJobStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcJobStores.get("MySQL").name());
    assertEquals("postgresql", JdbcJobStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcJobStores.get("H2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcJobStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown job store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromUrl() {
    assertEquals("mysql", JdbcJobStores.detect("jdbc:mysql://localhost:3306/jobs").name());
    assertEquals("mysql", JdbcJobStores.detect("jdbc:tidb://localhost:4000/jobs").name());
    assertInstanceOf(PostgresJobStore.class, JdbcJobStores.detect("jdbc:postgresql://localhost/jobs"));
    assertEquals("h2", JdbcJobStores.detect("JDBC:H2:mem:test").name());
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcJobStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("Supported prefixes"));
    assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect(""));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID());

    assertEquals("h2", JdbcJobStores.detect(ds).name());
  }

  @Test
  void withTableNameKeepsDialect() {
    AbstractJdbcJobStore store = JdbcJobStores.get("postgresql").withTableName("media_job");

    assertInstanceOf(PostgresJobStore.class, store);
    assertThrows(IllegalArgumentException.class, () -> store.withTableName("jobs; DROP TABLE x"));
  }

  @Test
  void purgerMatchesStoreName() {
    assertInstanceOf(MySqlJobPurger.class, JdbcJobPurgers.forStore("mysql", "job_record"));
    assertThrows(IllegalArgumentException.class, () -> JdbcJobPurgers.forStore("oracle", "job_record"));
  }

  @Test
  void tableNamesAreValidated() {
    assertEquals("job_record", TableNames.validate("job_record"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1jobs"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("jobs-x"));
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }
}
