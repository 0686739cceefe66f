/**
 * JDBC plumbing shared by the job stores, purgers and the pgmq gateway.
 *
 * @see jobqueue.jdbc.store.JdbcJobStores
 * @see jobqueue.jdbc.queue.PgmqQueueGateway
 */
package jobqueue.jdbc;
