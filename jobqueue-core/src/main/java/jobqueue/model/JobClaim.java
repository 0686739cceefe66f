package jobqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Proof that a worker holds the exclusive claim on a job.
 *
 * <p>The {@code token} is fresh for every successful claim and acts as the
 * claim's version: finalizing or yielding is conditional on it, so a worker whose
 * claim was taken over can never overwrite the newer attempt.
 *
 * @param jobId     the claimed job
 * @param token     random token written with the claim
 * @param ownerId   worker that holds the claim
 * @param claimedAt claim timestamp as stored (millisecond precision)
 * @param attempt   the record's attempt count after this claim (1 for the first claim)
 */
public record JobClaim(
    String jobId,
    String token,
    String ownerId,
    Instant claimedAt,
    int attempt
) {
  public JobClaim {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(claimedAt, "claimedAt");
  }
}
