package jobqueue.purge;

import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobPurger;
import jobqueue.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes finished job records (COMPLETED, SKIPPED, FAILED,
 * TIMED_OUT) older than a retention period.
 *
 * <p>Each cycle deletes in batches until fewer than {@code batchSize} rows are
 * deleted. Each batch uses its own auto-committed connection to limit lock duration.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see JobPurger
 */
public final class JobPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobPurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobPurger purger;
  private final Duration retention;
  private final int batchSize;
  private final Duration interval;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private JobPurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");

    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval != null && (builder.interval.isNegative() || builder.interval.isZero())) {
      throw new IllegalArgumentException("interval must be positive");
    }

    this.retention = builder.retention != null ? builder.retention : Duration.ofDays(30);
    this.batchSize = builder.batchSize;
    this.interval = builder.interval != null ? builder.interval : Duration.ofHours(1);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-purge-"));
    long ms = interval.toMillis();
    purgeTask = scheduler.scheduleWithFixedDelay(this::runOnce, ms, ms, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single purge cycle. May be invoked directly for one-off purges.
   *
   * @return the number of records deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant cutoff = clock.instant().minus(retention);
      long totalDeleted = 0;
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        totalDeleted += deleted;
      } while (deleted >= batchSize);
      if (totalDeleted > 0) {
        logger.log(Level.INFO, "Purged {0} finished jobs older than {1}",
            new Object[]{totalDeleted, cutoff});
      }
      return totalDeleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Purge cycle failed", t);
      return 0;
    }
  }

  private int purgeBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return purger.purge(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
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

  /** Builder for {@link JobPurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobPurger purger;
    private Duration retention;
    private int batchSize = 500;
    private Duration interval;
    private Clock clock;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param purger the dialect-specific purger
     * @return this builder
     */
    public Builder purger(JobPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Sets how long finished jobs are kept. Defaults to 30 days. Must be &ge; 0.
     *
     * @param retention the retention duration
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the maximum rows deleted per batch. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize max rows per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between purge cycles. Defaults to 1 hour.
     *
     * @param interval purge interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the purge scheduler. Call {@link JobPurgeScheduler#start()} to begin.
     *
     * @throws NullPointerException if {@code connectionProvider} or {@code purger} is null
     * @throws IllegalArgumentException if {@code retention} is negative,
     *     {@code batchSize <= 0}, or {@code interval} is not positive
     */
    public JobPurgeScheduler build() {
      return new JobPurgeScheduler(this);
    }
  }
}
