package jobqueue;

import jobqueue.admin.JobAdmin;
import jobqueue.purge.JobPurgeScheduler;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobPurger;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.spi.QueueGateway;
import jobqueue.spi.StuckJobScanner;
import jobqueue.util.JsonCodec;
import jobqueue.worker.StuckJobReclaimer;
import jobqueue.worker.WorkerConfig;
import jobqueue.worker.WorkerLoop;
import jobqueue.worker.WorkerStatus;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link WorkerLoop}, an optional
 * {@link StuckJobReclaimer} and an optional {@link JobPurgeScheduler} into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (JobWorker worker = JobWorker.builder()
 *     .connectionProvider(connProvider)
 *     .queueGateway(new PgmqQueueGateway(connProvider, "transcription_jobs"))
 *     .jobStore(store)
 *     .pipeline(pipeline)
 *     .config(WorkerConfig.fromEnvironment())
 *     .reclaimInterval(Duration.ofMinutes(1))
 *     .build()) {
 *   worker.start();
 *   // ...
 * }
 * }</pre>
 */
public final class JobWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobWorker.class.getName());

  private final WorkerLoop loop;
  private final StuckJobReclaimer reclaimer;
  private final JobPurgeScheduler purgeScheduler;
  private final JobAdmin admin;
  private final MetricsExporter metrics;

  private JobWorker(WorkerLoop loop, StuckJobReclaimer reclaimer, JobPurgeScheduler purgeScheduler,
      JobAdmin admin, MetricsExporter metrics) {
    this.loop = loop;
    this.reclaimer = reclaimer;
    this.purgeScheduler = purgeScheduler;
    this.admin = admin;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the loop and any configured background components. */
  public void start() {
    loop.start();
    if (reclaimer != null) {
      reclaimer.start();
    }
    if (purgeScheduler != null) {
      purgeScheduler.start();
    }
  }

  public WorkerLoop loop() {
    return loop;
  }

  /** The operator facade over the same store and connections. */
  public JobAdmin admin() {
    return admin;
  }

  public WorkerStatus status() {
    return loop.status();
  }

  /**
   * Shuts down components in order: purge scheduler, reclaimer, loop, then the
   * metrics exporter if it is {@link AutoCloseable}. Every component is closed even
   * if an earlier one fails; the first failure is rethrown with the others suppressed.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (purgeScheduler != null) {
      try {
        purgeScheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (reclaimer != null) {
      try {
        reclaimer.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    try {
      loop.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      logger.log(Level.WARNING, "Job worker closed with errors", first);
      throw first;
    }
  }

  /** Builder for {@link JobWorker}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueGateway queueGateway;
    private JobStore jobStore;
    private StuckJobScanner scanner;
    private ProcessingPipeline pipeline;
    private WorkerConfig config;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;
    private Duration reclaimInterval;
    private Duration reclaimSkipRecent;
    private JobPurger purger;
    private Duration purgeRetention;
    private Duration purgeInterval;
    private int purgeBatchSize = 500;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder queueGateway(QueueGateway queueGateway) {
      this.queueGateway = queueGateway;
      return this;
    }

    /** <b>Required.</b> If it also implements {@link StuckJobScanner} it is used as the scanner. */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder pipeline(ProcessingPipeline pipeline) {
      this.pipeline = pipeline;
      return this;
    }

    public Builder config(WorkerConfig config) {
      this.config = config;
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

    /** Explicit scanner, when the job store does not implement {@link StuckJobScanner}. */
    public Builder scanner(StuckJobScanner scanner) {
      this.scanner = scanner;
      return this;
    }

    /**
     * Enables the {@link StuckJobReclaimer} with the given scan interval.
     * Disabled unless called.
     */
    public Builder reclaimInterval(Duration reclaimInterval) {
      this.reclaimInterval = reclaimInterval;
      return this;
    }

    /** Reclaimer grace period. Defaults to the config's visibility timeout. */
    public Builder reclaimSkipRecent(Duration reclaimSkipRecent) {
      this.reclaimSkipRecent = reclaimSkipRecent;
      return this;
    }

    /** Enables the {@link JobPurgeScheduler}. Disabled unless called. */
    public Builder purger(JobPurger purger) {
      this.purger = purger;
      return this;
    }

    public Builder purgeRetention(Duration purgeRetention) {
      this.purgeRetention = purgeRetention;
      return this;
    }

    public Builder purgeInterval(Duration purgeInterval) {
      this.purgeInterval = purgeInterval;
      return this;
    }

    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    /**
     * Builds the worker. Nothing runs until {@link JobWorker#start()}.
     *
     * @throws NullPointerException  if a required component is missing
     * @throws IllegalStateException if reclaiming is enabled without a scanner
     */
    public JobWorker build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(jobStore, "jobStore");
      Objects.requireNonNull(pipeline, "pipeline");
      WorkerConfig effectiveConfig = config != null ? config : WorkerConfig.defaults();
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;

      WorkerLoop loop = WorkerLoop.builder()
          .connectionProvider(connectionProvider)
          .queueGateway(queueGateway)
          .jobStore(jobStore)
          .pipeline(pipeline)
          .config(effectiveConfig)
          .metrics(effectiveMetrics)
          .jsonCodec(jsonCodec)
          .clock(effectiveClock)
          .build();

      StuckJobReclaimer reclaimer = null;
      if (reclaimInterval != null) {
        StuckJobScanner effectiveScanner = scanner;
        if (effectiveScanner == null && jobStore instanceof StuckJobScanner storeScanner) {
          effectiveScanner = storeScanner;
        }
        if (effectiveScanner == null) {
          throw new IllegalStateException("Reclaiming requires a StuckJobScanner");
        }
        reclaimer = StuckJobReclaimer.builder()
            .connectionProvider(connectionProvider)
            .jobStore(jobStore)
            .scanner(effectiveScanner)
            .pipeline(pipeline)
            .config(effectiveConfig)
            .interval(reclaimInterval)
            .skipRecent(reclaimSkipRecent)
            .metrics(effectiveMetrics)
            .jsonCodec(jsonCodec)
            .clock(effectiveClock)
            .build();
      }

      JobPurgeScheduler purgeScheduler = null;
      if (purger != null) {
        purgeScheduler = JobPurgeScheduler.builder()
            .connectionProvider(connectionProvider)
            .purger(purger)
            .retention(purgeRetention)
            .interval(purgeInterval)
            .batchSize(purgeBatchSize)
            .clock(effectiveClock)
            .build();
      }

      JobAdmin admin = new JobAdmin(connectionProvider, jobStore, effectiveClock);
      return new JobWorker(loop, reclaimer, purgeScheduler, admin, effectiveMetrics);
    }
  }
}
