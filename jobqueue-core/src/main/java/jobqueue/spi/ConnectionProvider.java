package jobqueue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for worker, reclaimer, admin and purge operations.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see jobqueue.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
