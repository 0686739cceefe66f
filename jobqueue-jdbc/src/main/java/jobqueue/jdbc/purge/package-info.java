/**
 * JDBC {@link jobqueue.spi.JobPurger} implementations that delete finished job records
 * past their retention.
 */
package jobqueue.jdbc.purge;
