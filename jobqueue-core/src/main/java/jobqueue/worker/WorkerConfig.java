package jobqueue.worker;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable tuning for {@link WorkerLoop} and {@link StuckJobReclaimer}.
 *
 * <p>Build one with {@link #builder()}, or read it from {@code JOBQUEUE_*} environment
 * variables with {@link #fromEnvironment(Map)}.
 *
 * <table>
 *   <caption>Environment variables</caption>
 *   <tr><th>Variable</th><th>Default</th></tr>
 *   <tr><td>{@code JOBQUEUE_BATCH_SIZE}</td><td>10</td></tr>
 *   <tr><td>{@code JOBQUEUE_VISIBILITY_SECONDS}</td><td>1800</td></tr>
 *   <tr><td>{@code JOBQUEUE_MAX_RETRIES}</td><td>5</td></tr>
 *   <tr><td>{@code JOBQUEUE_IDLE_SLEEP_SECONDS}</td><td>5</td></tr>
 *   <tr><td>{@code JOBQUEUE_MAX_IDLE_SLEEP_SECONDS}</td><td>60</td></tr>
 *   <tr><td>{@code JOBQUEUE_STALENESS_THRESHOLD_SECONDS}</td><td>2100</td></tr>
 *   <tr><td>{@code JOBQUEUE_POLL_INTERVAL_SECONDS}</td><td>5</td></tr>
 *   <tr><td>{@code JOBQUEUE_STARTUP_DELAY_SECONDS}</td><td>5</td></tr>
 *   <tr><td>{@code JOBQUEUE_CONCURRENCY}</td><td>4</td></tr>
 *   <tr><td>{@code JOBQUEUE_SHUTDOWN_TIMEOUT_SECONDS}</td><td>120</td></tr>
 *   <tr><td>{@code JOBQUEUE_OWNER_ID}</td><td>{@code worker-<8 hex chars>}</td></tr>
 * </table>
 */
public final class WorkerConfig {
  private static final Logger logger = Logger.getLogger(WorkerConfig.class.getName());

  public static final String ENV_BATCH_SIZE = "JOBQUEUE_BATCH_SIZE";
  public static final String ENV_VISIBILITY_SECONDS = "JOBQUEUE_VISIBILITY_SECONDS";
  public static final String ENV_MAX_RETRIES = "JOBQUEUE_MAX_RETRIES";
  public static final String ENV_IDLE_SLEEP_SECONDS = "JOBQUEUE_IDLE_SLEEP_SECONDS";
  public static final String ENV_MAX_IDLE_SLEEP_SECONDS = "JOBQUEUE_MAX_IDLE_SLEEP_SECONDS";
  public static final String ENV_STALENESS_THRESHOLD_SECONDS = "JOBQUEUE_STALENESS_THRESHOLD_SECONDS";
  public static final String ENV_POLL_INTERVAL_SECONDS = "JOBQUEUE_POLL_INTERVAL_SECONDS";
  public static final String ENV_STARTUP_DELAY_SECONDS = "JOBQUEUE_STARTUP_DELAY_SECONDS";
  public static final String ENV_CONCURRENCY = "JOBQUEUE_CONCURRENCY";
  public static final String ENV_SHUTDOWN_TIMEOUT_SECONDS = "JOBQUEUE_SHUTDOWN_TIMEOUT_SECONDS";
  public static final String ENV_OWNER_ID = "JOBQUEUE_OWNER_ID";

  private final int batchSize;
  private final Duration visibility;
  private final int maxRetries;
  private final Duration idleSleep;
  private final Duration maxIdleSleep;
  private final Duration stalenessThreshold;
  private final Duration pollInterval;
  private final Duration startupDelay;
  private final int concurrency;
  private final Duration shutdownTimeout;
  private final String ownerId;

  private WorkerConfig(Builder builder) {
    this.visibility = Objects.requireNonNull(builder.visibility, "visibility");
    this.idleSleep = Objects.requireNonNull(builder.idleSleep, "idleSleep");
    this.maxIdleSleep = Objects.requireNonNull(builder.maxIdleSleep, "maxIdleSleep");
    this.stalenessThreshold = Objects.requireNonNull(builder.stalenessThreshold, "stalenessThreshold");
    this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
    this.startupDelay = Objects.requireNonNull(builder.startupDelay, "startupDelay");
    this.shutdownTimeout = Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.maxRetries <= 0) {
      throw new IllegalArgumentException("maxRetries must be > 0");
    }
    if (builder.concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }
    requirePositive(visibility, "visibility");
    requirePositive(idleSleep, "idleSleep");
    requirePositive(stalenessThreshold, "stalenessThreshold");
    if (maxIdleSleep.compareTo(idleSleep) < 0) {
      throw new IllegalArgumentException("maxIdleSleep must be >= idleSleep");
    }
    if (pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be >= 0");
    }
    if (startupDelay.isNegative()) {
      throw new IllegalArgumentException("startupDelay must be >= 0");
    }
    if (shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("shutdownTimeout must be >= 0");
    }

    this.batchSize = builder.batchSize;
    this.maxRetries = builder.maxRetries;
    this.concurrency = builder.concurrency;
    this.ownerId = builder.ownerId != null ? builder.ownerId : defaultOwnerId();
    if (ownerId.isBlank()) {
      throw new IllegalArgumentException("ownerId must not be blank");
    }

    if (stalenessThreshold.compareTo(visibility) <= 0) {
      logger.log(Level.WARNING,
          "Staleness threshold {0} does not exceed the visibility timeout {1}; "
              + "a slow but healthy attempt may be taken over by another worker",
          new Object[]{stalenessThreshold, visibility});
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Configuration with every default applied. */
  public static WorkerConfig defaults() {
    return builder().build();
  }

  /** Reads the configuration from the process environment. */
  public static WorkerConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from {@code JOBQUEUE_*} variables. Unset or blank
   * variables take their defaults.
   *
   * @param env environment variables
   * @return the configuration
   * @throws IllegalArgumentException naming the variable, if a value is malformed or out of range
   */
  public static WorkerConfig fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    Builder builder = builder()
        .batchSize(intVar(env, ENV_BATCH_SIZE, Builder.DEFAULT_BATCH_SIZE, 1))
        .visibility(secondsVar(env, ENV_VISIBILITY_SECONDS, Builder.DEFAULT_VISIBILITY, 1))
        .maxRetries(intVar(env, ENV_MAX_RETRIES, Builder.DEFAULT_MAX_RETRIES, 1))
        .idleSleep(secondsVar(env, ENV_IDLE_SLEEP_SECONDS, Builder.DEFAULT_IDLE_SLEEP, 1))
        .maxIdleSleep(secondsVar(env, ENV_MAX_IDLE_SLEEP_SECONDS, Builder.DEFAULT_MAX_IDLE_SLEEP, 1))
        .stalenessThreshold(secondsVar(env, ENV_STALENESS_THRESHOLD_SECONDS,
            Builder.DEFAULT_STALENESS_THRESHOLD, 1))
        .pollInterval(secondsVar(env, ENV_POLL_INTERVAL_SECONDS, Builder.DEFAULT_POLL_INTERVAL, 0))
        .startupDelay(secondsVar(env, ENV_STARTUP_DELAY_SECONDS, Builder.DEFAULT_STARTUP_DELAY, 0))
        .concurrency(intVar(env, ENV_CONCURRENCY, Builder.DEFAULT_CONCURRENCY, 1))
        .shutdownTimeout(secondsVar(env, ENV_SHUTDOWN_TIMEOUT_SECONDS, Builder.DEFAULT_SHUTDOWN_TIMEOUT, 0));
    String ownerId = env.get(ENV_OWNER_ID);
    if (ownerId != null && !ownerId.isBlank()) {
      builder.ownerId(ownerId.trim());
    }
    Duration idle = builder.idleSleep;
    if (builder.maxIdleSleep.compareTo(idle) < 0) {
      throw new IllegalArgumentException(ENV_MAX_IDLE_SLEEP_SECONDS + " must be >= " + ENV_IDLE_SLEEP_SECONDS);
    }
    return builder.build();
  }

  private static int intVar(Map<String, String> env, String name, int defaultValue, int min) {
    String raw = env.get(name);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got: " + raw, e);
    }
    if (value < min) {
      throw new IllegalArgumentException(name + " must be >= " + min + ", got: " + value);
    }
    return value;
  }

  private static Duration secondsVar(Map<String, String> env, String name, Duration defaultValue, int min) {
    String raw = env.get(name);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Duration.ofSeconds(intVar(env, name, 0, min));
  }

  private static void requirePositive(Duration value, String name) {
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  private static String defaultOwnerId() {
    return "worker-" + UUID.randomUUID().toString().substring(0, 8);
  }

  /** Maximum messages requested per dequeue. */
  public int batchSize() {
    return batchSize;
  }

  /** How long a dequeued message stays invisible before redelivery. */
  public Duration visibility() {
    return visibility;
  }

  /** Delivery count at which a failing job is finalized instead of retried. */
  public int maxRetries() {
    return maxRetries;
  }

  public Duration idleSleep() {
    return idleSleep;
  }

  public Duration maxIdleSleep() {
    return maxIdleSleep;
  }

  /** Age after which another worker may take over a claim. */
  public Duration stalenessThreshold() {
    return stalenessThreshold;
  }

  /** Pause after a non-empty batch. */
  public Duration pollInterval() {
    return pollInterval;
  }

  public Duration startupDelay() {
    return startupDelay;
  }

  /** Number of attempts executed in parallel. */
  public int concurrency() {
    return concurrency;
  }

  /** Upper bound on draining in-flight attempts at close. */
  public Duration shutdownTimeout() {
    return shutdownTimeout;
  }

  /** Identity written into claims. */
  public String ownerId() {
    return ownerId;
  }

  public Builder toBuilder() {
    return builder()
        .batchSize(batchSize)
        .visibility(visibility)
        .maxRetries(maxRetries)
        .idleSleep(idleSleep)
        .maxIdleSleep(maxIdleSleep)
        .stalenessThreshold(stalenessThreshold)
        .pollInterval(pollInterval)
        .startupDelay(startupDelay)
        .concurrency(concurrency)
        .shutdownTimeout(shutdownTimeout)
        .ownerId(ownerId);
  }

  @Override
  public String toString() {
    return "WorkerConfig{ownerId=" + ownerId
        + ", batchSize=" + batchSize
        + ", visibility=" + visibility
        + ", maxRetries=" + maxRetries
        + ", idleSleep=" + idleSleep
        + ", maxIdleSleep=" + maxIdleSleep
        + ", stalenessThreshold=" + stalenessThreshold
        + ", pollInterval=" + pollInterval
        + ", startupDelay=" + startupDelay
        + ", concurrency=" + concurrency
        + ", shutdownTimeout=" + shutdownTimeout + '}';
  }

  /** Builder for {@link WorkerConfig}. All settings are optional. */
  public static final class Builder {
    static final int DEFAULT_BATCH_SIZE = 10;
    static final Duration DEFAULT_VISIBILITY = Duration.ofSeconds(1800);
    static final int DEFAULT_MAX_RETRIES = 5;
    static final Duration DEFAULT_IDLE_SLEEP = Duration.ofSeconds(5);
    static final Duration DEFAULT_MAX_IDLE_SLEEP = Duration.ofSeconds(60);
    static final Duration DEFAULT_STALENESS_THRESHOLD = Duration.ofSeconds(2100);
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    static final Duration DEFAULT_STARTUP_DELAY = Duration.ofSeconds(5);
    static final int DEFAULT_CONCURRENCY = 4;
    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(120);

    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration visibility = DEFAULT_VISIBILITY;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Duration idleSleep = DEFAULT_IDLE_SLEEP;
    private Duration maxIdleSleep = DEFAULT_MAX_IDLE_SLEEP;
    private Duration stalenessThreshold = DEFAULT_STALENESS_THRESHOLD;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private Duration startupDelay = DEFAULT_STARTUP_DELAY;
    private int concurrency = DEFAULT_CONCURRENCY;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    private String ownerId;

    private Builder() {
    }

    /**
     * Sets the maximum number of messages requested per dequeue.
     *
     * <p>Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the visibility timeout passed to the queue.
     *
     * <p>Defaults to 30 minutes. Must be positive.
     */
    public Builder visibility(Duration visibility) {
      this.visibility = visibility;
      return this;
    }

    /**
     * Sets the delivery count at which a failing job stops being retried.
     *
     * <p>Defaults to {@code 5}. Must be &gt; 0.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /** Sets the first idle sleep after an empty dequeue. Defaults to 5 seconds. */
    public Builder idleSleep(Duration idleSleep) {
      this.idleSleep = idleSleep;
      return this;
    }

    /** Sets the cap of the idle backoff. Defaults to 60 seconds. */
    public Builder maxIdleSleep(Duration maxIdleSleep) {
      this.maxIdleSleep = maxIdleSleep;
      return this;
    }

    /**
     * Sets the age after which a claim may be taken over.
     *
     * <p>Defaults to 35 minutes. Should exceed both the visibility timeout and the
     * longest expected attempt.
     */
    public Builder stalenessThreshold(Duration stalenessThreshold) {
      this.stalenessThreshold = stalenessThreshold;
      return this;
    }

    /** Sets the pause after a non-empty batch. Defaults to 5 seconds; zero disables it. */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /** Sets the delay before the first dequeue. Defaults to 5 seconds. */
    public Builder startupDelay(Duration startupDelay) {
      this.startupDelay = startupDelay;
      return this;
    }

    /** Sets the number of parallel attempts. Defaults to {@code 4}. */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /** Sets the drain timeout at close. Defaults to 120 seconds. */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * Sets the identity written into claims (e.g. hostname or pod name).
     *
     * <p>Defaults to {@code worker-} followed by 8 random hex characters.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @throws NullPointerException     if a duration is null
     * @throws IllegalArgumentException if a value is out of range
     */
    public WorkerConfig build() {
      return new WorkerConfig(this);
    }
  }
}
