package jobqueue.spi;

import jobqueue.JobOutcome;
import jobqueue.JobPayload;
import jobqueue.model.JobClaim;
import jobqueue.model.JobRecord;
import jobqueue.model.JobStatus;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for job records, managing the lifecycle
 * UNCLAIMED &rarr; CLAIMED &rarr; COMPLETED | SKIPPED | FAILED | TIMED_OUT.
 *
 * <p>Every state change is a single conditional write, so concurrent workers can
 * race on the same record without a read-then-write window. All methods receive an
 * explicit {@link Connection} so the caller controls transaction boundaries.
 * Implementations live in the {@code jobqueue-jdbc} module.
 *
 * @see jobqueue.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

    /**
     * Inserts an UNCLAIMED record for the payload's job id unless one already exists.
     *
     * @param conn    the JDBC connection
     * @param payload the decoded payload; its {@link JobPayload#jobId()} is the record key
     * @param now     creation timestamp
     * @return {@code true} if a record was inserted, {@code false} if it already existed
     */
    boolean registerIfAbsent(Connection conn, JobPayload payload, Instant now);

    /**
     * Atomically claims a job.
     *
     * <p>Succeeds if and only if, at the moment of the write, the record is UNCLAIMED,
     * or CLAIMED with a claim older than {@code stalenessThreshold}, or CLAIMED with a
     * yielded claim (see {@link #yieldClaim}). A successful claim stores a fresh token,
     * sets {@code claimed_at = now} and increments the attempt count. Of any number of
     * concurrent callers, at most one succeeds.
     *
     * @param conn               the JDBC connection
     * @param jobId              the job to claim
     * @param ownerId            identity of the claiming worker
     * @param now                claim timestamp
     * @param stalenessThreshold age after which an existing claim is considered abandoned
     * @return the claim if this caller now holds it, otherwise empty
     */
    Optional<JobClaim> claim(Connection conn, String jobId, String ownerId, Instant now,
                             Duration stalenessThreshold);

    /**
     * Records the terminal outcome of a claimed attempt.
     *
     * <p>Only applies while the record is still CLAIMED under {@code claim}'s token.
     * If the claim was taken over or the job was already finalized or reset, nothing
     * is written and {@code false} is returned.
     *
     * @param conn    the JDBC connection
     * @param claim   the claim returned by {@link #claim}
     * @param outcome a terminal outcome
     * @param now     finish timestamp
     * @return {@code true} if the outcome was recorded
     * @throws IllegalArgumentException if the outcome's status is not terminal
     */
    boolean finalize(Connection conn, JobClaim claim, JobOutcome outcome, Instant now);

    /**
     * Gives up a claim after a retryable failure while keeping the record CLAIMED.
     *
     * <p>The error is stored as {@code last_error} and the claim is marked yielded,
     * which lets the next delivery of the job re-claim it immediately instead of
     * waiting out the staleness threshold. Conditional on {@code claim}'s token.
     *
     * @param conn  the JDBC connection
     * @param claim the claim returned by {@link #claim}
     * @param error error message from the failed attempt (may be {@code null})
     * @param now   update timestamp
     * @return {@code true} if the claim was yielded
     */
    boolean yieldClaim(Connection conn, JobClaim claim, String error, Instant now);

    /**
     * Operator action: returns a job in any status to UNCLAIMED and clears its attempt
     * fields (attempt count, claim token and owner, claim time, last error, finish time).
     *
     * @param conn            the JDBC connection
     * @param jobId           the job to reset
     * @param preserveHistory keep the last result and the completion count
     * @param now             update timestamp
     * @return {@code true} if the job exists and was reset
     */
    boolean reset(Connection conn, String jobId, boolean preserveHistory, Instant now);

    /**
     * Loads a job record.
     *
     * @param conn  the JDBC connection
     * @param jobId the job id
     * @return the record, or empty if it does not exist
     */
    Optional<JobRecord> find(Connection conn, String jobId);

    /**
     * Lists jobs in the given status, oldest first.
     *
     * @param conn   the JDBC connection
     * @param status status filter ({@code null} for all)
     * @param limit  maximum number of records to return
     * @return matching records
     */
    List<JobRecord> queryByStatus(Connection conn, JobStatus status, int limit);

    /**
     * Counts jobs in the given status.
     *
     * @param conn   the JDBC connection
     * @param status status filter ({@code null} for all)
     * @return the number of matching records
     */
    int countByStatus(Connection conn, JobStatus status);
}
