package jobqueue.worker;

import jobqueue.JobOutcome;
import jobqueue.JobPayload;
import jobqueue.MalformedPayloadException;
import jobqueue.PayloadDecoder;
import jobqueue.ProcessingPipeline;
import jobqueue.model.JobClaim;
import jobqueue.model.JobRecord;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.spi.StuckJobScanner;
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
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled database scanner that recovers jobs the queue path cannot: claims
 * abandoned by a crashed worker (older than the staleness threshold), UNCLAIMED
 * records with no live message, such as jobs reset by an operator, and yielded
 * claims whose retry has no message to redeliver it.
 *
 * <p>Each cycle asks the {@link StuckJobScanner} for candidates, claims each one
 * through {@link JobStore#claim} (which re-checks the condition atomically) and runs
 * the attempt on the scheduler thread. The claim's attempt number serves as the retry
 * counter, so a job still fails for good after {@code maxRetries} attempts.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class StuckJobReclaimer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StuckJobReclaimer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final StuckJobScanner scanner;
  private final WorkerConfig config;
  private final Duration interval;
  private final Duration skipRecent;
  private final int batchSize;
  private final MetricsExporter metrics;
  private final PayloadDecoder decoder;
  private final Clock clock;
  private final WorkerStats stats;
  private final AttemptRunner attempts;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reclaimTask;
  private volatile boolean closed;

  private StuckJobReclaimer(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.scanner = Objects.requireNonNull(builder.scanner, "scanner");
    ProcessingPipeline pipeline = Objects.requireNonNull(builder.pipeline, "pipeline");

    this.config = builder.config != null ? builder.config : WorkerConfig.defaults();
    this.interval = builder.interval != null ? builder.interval : Duration.ofMinutes(1);
    this.skipRecent = builder.skipRecent != null ? builder.skipRecent : config.visibility();
    this.batchSize = builder.batchSize > 0 ? builder.batchSize : config.batchSize();
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (skipRecent.isNegative()) {
      throw new IllegalArgumentException("skipRecent must be >= 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.decoder = new PayloadDecoder(builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault());
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.stats = new WorkerStats();
    this.attempts = new AttemptRunner(connectionProvider, jobStore, pipeline,
        config.maxRetries(), metrics, stats, clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled scan. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("StuckJobReclaimer has been closed");
    }
    if (reclaimTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-reclaimer-"));
    long ms = interval.toMillis();
    reclaimTask = scheduler.scheduleWithFixedDelay(this::reclaimOnce, ms, ms, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single scan. Called by the scheduler, but may also be invoked directly.
   *
   * @return the number of jobs claimed and attempted
   */
  public int reclaimOnce() {
    if (closed) {
      return 0;
    }
    try {
      List<String> candidates = findCandidates(clock.instant());
      int attempted = 0;
      for (String jobId : candidates) {
        if (closed || Thread.currentThread().isInterrupted()) {
          break;
        }
        if (reclaim(jobId)) {
          attempted++;
        }
      }
      return attempted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reclaim cycle failed", t);
      return 0;
    }
  }

  private List<String> findCandidates(Instant now) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return scanner.findReclaimable(conn, now, config.stalenessThreshold(), skipRecent, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to scan for reclaimable jobs", e);
      return List.of();
    }
  }

  private boolean reclaim(String jobId) {
    Instant now = clock.instant();
    Optional<JobRecord> record;
    Optional<JobClaim> claim;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      record = jobStore.find(conn, jobId);
      if (record.isEmpty()) {
        return false;
      }
      claim = jobStore.claim(conn, jobId, config.ownerId(), now, config.stalenessThreshold());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to claim job " + jobId + " for reclaim", e);
      return false;
    }
    if (claim.isEmpty()) {
      logger.log(Level.FINE, "Job {0} was claimed by another worker first", jobId);
      return false;
    }

    JobRecord previous = record.get();
    logger.log(Level.INFO, "Reclaimed job {0} (status {1}, previous owner {2}, attempt {3})",
        new Object[]{jobId, previous.status(), previous.claimedBy(), claim.get().attempt()});
    stats.reclaimed.incrementAndGet();
    metrics.incrementReclaimed();

    JobPayload payload;
    try {
      payload = decoder.decode(previous.payloadJson());
    } catch (MalformedPayloadException e) {
      failMalformed(claim.get(), e);
      return true;
    }
    attempts.run(payload, claim.get(), claim.get().attempt(), null);
    return true;
  }

  private void failMalformed(JobClaim claim, MalformedPayloadException e) {
    String error = "Malformed stored payload: " + e.getMessage();
    logger.log(Level.WARNING, "Job {0} has a malformed stored payload; failing it", claim.jobId());
    Instant now = clock.instant();
    stats.error(claim.jobId(), null, error, now);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (jobStore.finalize(conn, claim, new JobOutcome.Failed(error), now)) {
        stats.failed.incrementAndGet();
        metrics.incrementJobsFailed();
      }
    } catch (SQLException | RuntimeException ex) {
      logger.log(Level.SEVERE, "Failed to finalize job " + claim.jobId(), ex);
    }
  }

  /** Returns a snapshot of this reclaimer's counters and recent errors. */
  public WorkerStatus status() {
    return stats.snapshot(reclaimTask != null && !closed, config.ownerId(), null, 0);
  }

  /**
   * Cancels the scan schedule and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (reclaimTask != null) {
      reclaimTask.cancel(false);
      reclaimTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link StuckJobReclaimer}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private StuckJobScanner scanner;
    private ProcessingPipeline pipeline;
    private WorkerConfig config;
    private Duration interval;
    private Duration skipRecent;
    private int batchSize;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> Connection provider for scans, claims and writes. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Store used to load, claim and finalize jobs. */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /** <b>Required.</b> Candidate query; JDBC stores implement it too. */
    public Builder scanner(StuckJobScanner scanner) {
      this.scanner = scanner;
      return this;
    }

    /** <b>Required.</b> Pipeline that performs the work. */
    public Builder pipeline(ProcessingPipeline pipeline) {
      this.pipeline = pipeline;
      return this;
    }

    /** Staleness threshold, retry budget and owner id. Defaults to {@link WorkerConfig#defaults()}. */
    public Builder config(WorkerConfig config) {
      this.config = config;
      return this;
    }

    /** Delay between scans. Defaults to 1 minute. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Grace period before an UNCLAIMED job or a yielded claim is picked up, leaving the
     * queue delivery or redelivery time to arrive first. Defaults to the config's
     * visibility timeout.
     */
    public Builder skipRecent(Duration skipRecent) {
      this.skipRecent = skipRecent;
      return this;
    }

    /** Maximum jobs per scan. Defaults to the config's batch size. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the reclaimer. Call {@link StuckJobReclaimer#start()} to begin scanning.
     *
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if {@code interval} is not positive or {@code skipRecent} is negative
     */
    public StuckJobReclaimer build() {
      return new StuckJobReclaimer(this);
    }
  }
}
