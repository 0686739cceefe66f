package jobqueue.model;

import java.time.Instant;

/**
 * Read-only view of a persisted job record, as returned by
 * {@link jobqueue.spi.JobStore#find} and {@link jobqueue.spi.JobStore#queryByStatus}.
 *
 * <p>{@code result} and {@code completedCount} are history: an operator reset
 * keeps them unless asked otherwise.
 */
public record JobRecord(
    String jobId,
    JobKind kind,
    String payloadJson,
    JobStatus status,
    int attemptCount,
    String claimedBy,
    Instant claimedAt,
    boolean claimYielded,
    String result,
    String lastError,
    int completedCount,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {}
