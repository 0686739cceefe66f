package jobqueue.spi;

/**
 * Observability hook for exporting worker counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds the number of messages received by one dequeue call.
     */
    void incrementMessagesReceived(int count);

    /**
     * Increments the count of jobs finalized COMPLETED.
     */
    void incrementJobsCompleted();

    /**
     * Increments the count of jobs finalized SKIPPED.
     */
    void incrementJobsSkipped();

    /**
     * Increments the count of jobs finalized FAILED or TIMED_OUT.
     */
    void incrementJobsFailed();

    /**
     * Increments the count of failed attempts left for redelivery.
     */
    void incrementRetries();

    /**
     * Increments the count of messages moved to the queue archive.
     */
    void incrementArchived();

    /**
     * Increments the count of deliveries dropped because another worker
     * holds or already finished the job.
     */
    void incrementRedundant();

    /**
     * Increments the count of stale or orphaned jobs picked up by the reclaimer.
     */
    default void incrementReclaimed() {
    }

    /**
     * Records the number of attempts currently executing.
     *
     * @param inFlight running attempts
     */
    void recordInFlight(int inFlight);

    /**
     * Records the time a message waited in the queue before this delivery.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    default void recordQueueLagMs(long lagMs) {
    }

    /**
     * Records the time spent in the processing pipeline for one attempt.
     *
     * @param durationMs pipeline execution time in milliseconds (always non-negative)
     */
    default void recordJobDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementMessagesReceived(int count) {
        }

        @Override
        public void incrementJobsCompleted() {
        }

        @Override
        public void incrementJobsSkipped() {
        }

        @Override
        public void incrementJobsFailed() {
        }

        @Override
        public void incrementRetries() {
        }

        @Override
        public void incrementArchived() {
        }

        @Override
        public void incrementRedundant() {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }
    }
}
