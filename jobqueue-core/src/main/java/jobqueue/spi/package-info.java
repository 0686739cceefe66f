/**
 * Service provider interfaces for pluggable worker components.
 *
 * <p>Implement these interfaces to integrate with a specific message queue,
 * database, or metrics backend. The {@code jobqueue-jdbc} module provides JDBC stores
 * and a pgmq queue gateway; {@code jobqueue-micrometer} provides a metrics exporter.
 *
 * @see jobqueue.spi.QueueGateway
 * @see jobqueue.spi.JobStore
 * @see jobqueue.spi.StuckJobScanner
 * @see jobqueue.spi.ConnectionProvider
 * @see jobqueue.spi.MetricsExporter
 * @see jobqueue.spi.JobPurger
 */
package jobqueue.spi;
