package jobqueue.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes finished job records to bound table growth.
 *
 * @see jobqueue.purge.JobPurgeScheduler
 */
@FunctionalInterface
public interface JobPurger {

    /**
     * Deletes up to {@code limit} terminal records that finished before {@code before}.
     *
     * @param conn   the JDBC connection
     * @param before records finished earlier than this instant are eligible
     * @param limit  maximum rows to delete in this call
     * @return the number of rows deleted
     */
    int purge(Connection conn, Instant before, int limit);
}
