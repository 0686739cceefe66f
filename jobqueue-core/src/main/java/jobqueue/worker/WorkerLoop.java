package jobqueue.worker;

import jobqueue.JobPayload;
import jobqueue.MalformedPayloadException;
import jobqueue.PayloadDecoder;
import jobqueue.ProcessingPipeline;
import jobqueue.model.JobClaim;
import jobqueue.model.QueueMessage;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.spi.QueueGateway;
import jobqueue.util.DaemonThreadFactory;
import jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-running consumer that pulls job messages from a {@link QueueGateway}, claims
 * the referenced job through the {@link JobStore}, runs the {@link ProcessingPipeline}
 * and acknowledges the message only after the job state has been written.
 *
 * <p>Per delivery:
 * <ol>
 *   <li>Malformed payload: archive the message.
 *   <li>Claim refused (another worker owns or finished the job): delete the message.
 *   <li>Pipeline succeeds: finalize, then delete the message.
 *   <li>{@link jobqueue.NonRetryableJobException}: finalize FAILED, then archive.
 *   <li>Other failure with delivery count below {@code maxRetries}: yield the claim and
 *       leave the message to reappear after the visibility timeout.
 *   <li>Other failure at {@code maxRetries}: finalize FAILED (TIMED_OUT for timeouts),
 *       then archive.
 * </ol>
 * Store failures do not acknowledge: the message comes back after the visibility timeout.
 * Once its delivery count reaches {@code maxRetries} the message is archived instead and
 * the record, if any, is left for the {@link StuckJobReclaimer}.
 *
 * <p>Attempts run on a pool of {@code concurrency} daemon threads; the polling thread
 * only asks the queue for as many messages as there are free slots. After an empty
 * poll it sleeps according to {@link IdleBackoff}.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 *
 * @see WorkerLoop.Builder
 * @see WorkerConfig
 */
public final class WorkerLoop implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(WorkerLoop.class.getName());
    private static final long CAPACITY_WAIT_MS = 200;

    private final ConnectionProvider connectionProvider;
    private final QueueGateway queueGateway;
    private final JobStore jobStore;
    private final WorkerConfig config;
    private final MetricsExporter metrics;
    private final PayloadDecoder decoder;
    private final Clock clock;
    private final WorkerStats stats;
    private final AttemptRunner attempts;
    private final IdleBackoff backoff;
    private final Semaphore slots;
    private final CountDownLatch closeSignal = new CountDownLatch(1);

    private volatile ExecutorService workers;
    private volatile ExecutorService pollThread;
    private volatile Instant startedAt;
    private volatile boolean closed;

    private WorkerLoop(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.queueGateway = Objects.requireNonNull(builder.queueGateway, "queueGateway");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        ProcessingPipeline pipeline = Objects.requireNonNull(builder.pipeline, "pipeline");

        this.config = builder.config != null ? builder.config : WorkerConfig.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.decoder = new PayloadDecoder(builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault());
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.stats = new WorkerStats();
        this.attempts = new AttemptRunner(connectionProvider, jobStore, pipeline,
                config.maxRetries(), metrics, stats, clock);
        this.backoff = new IdleBackoff(config.idleSleep(), config.maxIdleSleep());
        this.slots = new Semaphore(config.concurrency());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the polling thread. The first dequeue happens after
     * {@link WorkerConfig#startupDelay()}. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("WorkerLoop has been closed");
        }
        if (pollThread != null) {
            return;
        }
        ensureWorkers();
        startedAt = clock.instant();
        pollThread = Executors.newSingleThreadExecutor(new DaemonThreadFactory("jobqueue-poller-"));
        pollThread.execute(this::runLoop);
        logger.log(Level.INFO, "Worker started: {0}", config);
    }

    private void runLoop() {
        if (!pause(config.startupDelay())) {
            return;
        }
        while (!closed) {
            Duration sleep;
            try {
                if (slots.availablePermits() == 0) {
                    if (!awaitCapacity()) {
                        return;
                    }
                    continue;
                }
                int dispatched = pollOnce();
                if (dispatched > 0) {
                    backoff.reset();
                    sleep = config.pollInterval();
                } else {
                    sleep = backoff.next();
                    logger.log(Level.FINE, "No messages, sleeping {0}", sleep);
                }
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Poll cycle failed", t);
                sleep = backoff.next();
            }
            if (!pause(sleep)) {
                return;
            }
        }
    }

    /**
     * Executes a single poll cycle: dequeues up to {@code min(batchSize, free slots)}
     * messages and hands each to the worker pool. Called by the polling thread, but may
     * also be invoked directly for testing.
     *
     * @return the number of messages handed to the pool
     */
    public int pollOnce() {
        if (closed) {
            return 0;
        }
        int want = Math.min(config.batchSize(), slots.availablePermits());
        if (want <= 0) {
            return 0;
        }
        List<QueueMessage> messages;
        try {
            messages = queueGateway.dequeue(config.visibility(), want);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to dequeue messages", e);
            stats.error(null, null, "Dequeue failed: " + AttemptRunner.describe(e), clock.instant());
            return 0;
        }
        stats.polled(clock.instant());
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        metrics.incrementMessagesReceived(messages.size());

        ExecutorService pool = ensureWorkers();
        int dispatched = 0;
        for (QueueMessage message : messages) {
            if (!slots.tryAcquire()) {
                // Not acknowledged: reappears after the visibility timeout.
                logger.log(Level.WARNING, "No free slot for message {0}; leaving it in the queue", message.id());
                continue;
            }
            try {
                pool.execute(() -> runAttempt(message));
                dispatched++;
                metrics.recordInFlight(inFlight());
            } catch (RejectedExecutionException e) {
                slots.release();
                logger.log(Level.WARNING, "Worker pool rejected message {0}; leaving it in the queue", message.id());
            }
        }
        return dispatched;
    }

    private void runAttempt(QueueMessage message) {
        try {
            process(message);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Unexpected failure processing message " + message.id(), t);
        } finally {
            slots.release();
            metrics.recordInFlight(inFlight());
        }
    }

    /**
     * Runs the full state machine for one delivery on the calling thread.
     *
     * @param message the delivery
     * @return what was done with the message
     */
    public MessageDisposition process(QueueMessage message) {
        Instant now = clock.instant();
        if (message.enqueuedAt() != null) {
            metrics.recordQueueLagMs(Math.max(0L, Duration.between(message.enqueuedAt(), now).toMillis()));
        }

        JobPayload payload;
        try {
            payload = decoder.decode(message.payloadJson());
        } catch (MalformedPayloadException e) {
            logger.log(Level.WARNING, "Archiving malformed message {0}: {1}",
                    new Object[]{message.id(), e.getMessage()});
            stats.error(null, message.id(), "Malformed payload: " + e.getMessage(), now);
            return archive(message);
        }

        String jobId = payload.jobId();
        logger.log(Level.FINE, "Processing message {0} for job {1} (delivery {2})",
                new Object[]{message.id(), jobId, message.deliveryCount()});

        Optional<JobClaim> claim;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            jobStore.registerIfAbsent(conn, payload, now);
            claim = jobStore.claim(conn, jobId, config.ownerId(), now, config.stalenessThreshold());
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim job " + jobId + " for message " + message.id(), e);
            stats.error(jobId, message.id(), "Claim failed: " + AttemptRunner.describe(e), now);
            return retainOrArchive(message);
        }

        if (claim.isEmpty()) {
            logger.log(Level.INFO, "Job {0} is owned by another worker or already finished; "
                    + "dropping redundant message {1}", new Object[]{jobId, message.id()});
            stats.redundant.incrementAndGet();
            metrics.incrementRedundant();
            return delete(message);
        }

        AttemptRunner.Result result = attempts.run(payload, claim.get(), message.deliveryCount(), message.id());
        switch (result) {
            case SUCCEEDED:
                return delete(message);
            case FAILED:
                return archive(message);
            case CLAIM_LOST:
                stats.redundant.incrementAndGet();
                metrics.incrementRedundant();
                return delete(message);
            case STORE_ERROR:
                return retainOrArchive(message);
            case RETRY:
            default:
                return MessageDisposition.RETAINED;
        }
    }

    /** After a store failure: redeliver while deliveries remain, archive once they are used up. */
    private MessageDisposition retainOrArchive(QueueMessage message) {
        if (message.deliveryCount() < config.maxRetries()) {
            logger.log(Level.WARNING, "Message {0} will be redelivered (delivery {1}/{2})",
                    new Object[]{message.id(), message.deliveryCount(), config.maxRetries()});
            return MessageDisposition.RETAINED;
        }
        logger.log(Level.SEVERE, "Archiving message {0}: store still failing after {1} deliveries",
                new Object[]{message.id(), message.deliveryCount()});
        return archive(message);
    }

    private MessageDisposition delete(QueueMessage message) {
        try {
            queueGateway.ackDelete(message.id());
            return MessageDisposition.DELETED;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to delete message " + message.id(), e);
            return MessageDisposition.RETAINED;
        }
    }

    private MessageDisposition archive(QueueMessage message) {
        try {
            queueGateway.ackArchive(message.id());
            stats.archived.incrementAndGet();
            metrics.incrementArchived();
            return MessageDisposition.ARCHIVED;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to archive message " + message.id(), e);
            return MessageDisposition.RETAINED;
        }
    }

    private ExecutorService ensureWorkers() {
        ExecutorService pool = workers;
        if (pool != null) {
            return pool;
        }
        synchronized (this) {
            if (workers == null) {
                workers = Executors.newFixedThreadPool(config.concurrency(),
                        new DaemonThreadFactory("jobqueue-worker-"));
            }
            return workers;
        }
    }

    /** Waits briefly for a free slot. Returns {@code false} if interrupted. */
    private boolean awaitCapacity() {
        try {
            if (slots.tryAcquire(CAPACITY_WAIT_MS, TimeUnit.MILLISECONDS)) {
                slots.release();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Sleeps unless closed first. Returns {@code false} if the loop should stop. */
    private boolean pause(Duration duration) {
        if (duration.isZero()) {
            return !closed;
        }
        try {
            return !closeSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS) && !closed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Number of attempts currently executing. */
    public int inFlight() {
        return config.concurrency() - slots.availablePermits();
    }

    public WorkerConfig config() {
        return config;
    }

    /**
     * Returns a snapshot of the worker's counters and recent errors.
     */
    public WorkerStatus status() {
        return stats.snapshot(pollThread != null && !closed, config.ownerId(), startedAt, inFlight());
    }

    WorkerStats stats() {
        return stats;
    }

    /**
     * Stops polling and waits up to {@link WorkerConfig#shutdownTimeout()} for in-flight
     * attempts. Attempts still running after that are interrupted; their messages are
     * not acknowledged and come back after the visibility timeout.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeSignal.countDown();
        if (pollThread != null) {
            pollThread.shutdownNow();
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.log(Level.WARNING, "{0} attempt(s) still running after {1}; interrupting",
                            new Object[]{inFlight(), config.shutdownTimeout()});
                    workers.shutdownNow();
                    workers.awaitTermination(5, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (pollThread != null) {
            try {
                pollThread.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.log(Level.INFO, "Worker {0} stopped", config.ownerId());
    }

    /**
     * Builder for {@link WorkerLoop}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private QueueGateway queueGateway;
        private JobStore jobStore;
        private ProcessingPipeline pipeline;
        private WorkerConfig config;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the connection provider used for job store operations.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the queue the worker consumes.
         *
         * <p><b>Required.</b>
         *
         * @param queueGateway the queue gateway
         * @return this builder
         */
        public Builder queueGateway(QueueGateway queueGateway) {
            this.queueGateway = queueGateway;
            return this;
        }

        /**
         * Sets the job store used to claim and finalize jobs.
         *
         * <p><b>Required.</b>
         *
         * @param jobStore the persistence backend
         * @return this builder
         */
        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * Sets the pipeline that performs the work.
         *
         * <p><b>Required.</b>
         *
         * @param pipeline the processing pipeline
         * @return this builder
         */
        public Builder pipeline(ProcessingPipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        /**
         * Sets the worker tuning.
         *
         * <p>Optional. Defaults to {@link WorkerConfig#defaults()}.
         *
         * @param config the worker configuration
         * @return this builder
         */
        public Builder config(WorkerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets a custom JSON codec for decoding message bodies.
         *
         * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
         *
         * @param jsonCodec the JSON codec
         * @return this builder
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Sets the clock used for claim and finish timestamps.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the worker. Call {@link WorkerLoop#start()} to begin polling.
         *
         * @return a new {@link WorkerLoop} instance
         * @throws NullPointerException if {@code connectionProvider}, {@code queueGateway},
         *                              {@code jobStore}, or {@code pipeline} is null
         */
        public WorkerLoop build() {
            return new WorkerLoop(this);
        }
    }
}
