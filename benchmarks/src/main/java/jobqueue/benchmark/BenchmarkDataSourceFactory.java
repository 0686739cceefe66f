package jobqueue.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.H2JobStore;
import jobqueue.jdbc.store.MySqlJobStore;
import jobqueue.jdbc.store.PostgresJobStore;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates a {@link DatabaseSetup} for the requested database type.
 *
 * <p>Supported types: {@code "h2"} (in-memory), {@code "mysql"}, and {@code "postgresql"} (external servers).
 * External database connection details are read from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}: default {@code jdbc:mysql://localhost:3306/jobqueue_bench}</li>
 *   <li>{@code bench.mysql.user}: default {@code root}</li>
 *   <li>{@code bench.mysql.password}: default {@code ""} (empty)</li>
 *   <li>{@code bench.pg.url}: default {@code jdbc:postgresql://localhost:5432/jobqueue_bench}</li>
 *   <li>{@code bench.pg.user}: default {@code postgres}</li>
 *   <li>{@code bench.pg.password}: default {@code postgres}</li>
 * </ul>
 * The external schema must not exist yet; it is created from the DDL shipped with
 * {@code jobqueue-jdbc}.
 */
final class BenchmarkDataSourceFactory {

  record DatabaseSetup(DataSource dataSource, AbstractJdbcJobStore store) {}

  static DatabaseSetup create(String database, String dbName) {
    return switch (database) {
      case "h2" -> createH2(dbName);
      case "mysql" -> createPooled(
          System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/jobqueue_bench"),
          System.getProperty("bench.mysql.user", "root"),
          System.getProperty("bench.mysql.password", ""),
          "/schema/mysql.sql", new MySqlJobStore());
      case "postgresql" -> createPooled(
          System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/jobqueue_bench"),
          System.getProperty("bench.pg.user", "postgres"),
          System.getProperty("bench.pg.password", "postgres"),
          "/schema/postgresql.sql", new PostgresJobStore());
      default -> throw new IllegalArgumentException("Unsupported database: " + database);
    };
  }

  private static DatabaseSetup createH2(String dbName) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1");
    initSchema(ds, "/schema/h2.sql");
    return new DatabaseSetup(ds, new H2JobStore());
  }

  private static DatabaseSetup createPooled(String url, String user, String password, String schema,
      AbstractJdbcJobStore store) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setPoolName("bench-" + store.name());
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    HikariDataSource ds = new HikariDataSource(config);
    initSchema(ds, schema);
    return new DatabaseSetup(ds, store);
  }

  private static void initSchema(DataSource ds, String resource) {
    String ddl;
    try (InputStream in = BenchmarkDataSourceFactory.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + resource);
      }
      ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : ddl.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to initialize benchmark schema", e);
    }
  }

  static void truncate(DataSource ds) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE TABLE job_record");
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to truncate benchmark table", e);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
