/**
 * {@link jobqueue.spi.QueueGateway} implementations backed by JDBC.
 */
package jobqueue.jdbc.queue;
