package jobqueue.spi;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-only query for jobs that a worker may legitimately claim without a queue
 * delivery: UNCLAIMED records, CLAIMED records whose claim is older than the
 * staleness threshold (the owner probably crashed), and yielded claims that no
 * redelivery has picked up within the grace period.
 *
 * <p>The result is only a hint. Candidates must still be claimed through
 * {@link JobStore#claim}, which re-checks the condition atomically.
 */
public interface StuckJobScanner {

    /**
     * Finds reclaimable jobs, oldest first.
     *
     * @param conn               the JDBC connection
     * @param now                current time
     * @param stalenessThreshold age after which a claim is considered abandoned
     * @param limit              maximum number of job ids to return
     * @return job ids ordered by creation time
     */
    default List<String> findReclaimable(Connection conn, Instant now, Duration stalenessThreshold, int limit) {
        return findReclaimable(conn, now, stalenessThreshold, Duration.ZERO, limit);
    }

    /**
     * Finds reclaimable jobs, oldest first, leaving UNCLAIMED jobs younger than
     * {@code skipRecent} and claims yielded less than {@code skipRecent} ago to the
     * queue path.
     *
     * @param conn               the JDBC connection
     * @param now                current time
     * @param stalenessThreshold age after which a claim is considered abandoned
     * @param skipRecent         grace period for fresh registrations and yields
     * @param limit              maximum number of job ids to return
     * @return job ids ordered by creation time
     */
    List<String> findReclaimable(Connection conn, Instant now, Duration stalenessThreshold,
                                 Duration skipRecent, int limit);
}
