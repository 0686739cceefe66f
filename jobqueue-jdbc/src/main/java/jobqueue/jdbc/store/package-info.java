/**
 * JDBC-based {@link jobqueue.spi.JobStore} and {@link jobqueue.spi.StuckJobScanner}
 * implementations.
 *
 * <p>{@link jobqueue.jdbc.store.AbstractJdbcJobStore} provides shared SQL and row mapping;
 * subclasses supply database-specific registration and claim statements: H2 (insert and
 * catch the duplicate key), MySQL ({@code INSERT IGNORE}) and PostgreSQL
 * ({@code ON CONFLICT DO NOTHING}, {@code UPDATE ... RETURNING}).
 *
 * @see jobqueue.jdbc.store.AbstractJdbcJobStore
 * @see jobqueue.jdbc.store.JdbcJobStores
 */
package jobqueue.jdbc.store;
