package jobqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jobqueue.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobqueue.messages.received}: messages returned by dequeue</li>
 *   <li>{@code jobqueue.jobs.completed}: jobs finalized COMPLETED</li>
 *   <li>{@code jobqueue.jobs.skipped}: jobs finalized SKIPPED</li>
 *   <li>{@code jobqueue.jobs.failed}: jobs finalized FAILED or TIMED_OUT</li>
 *   <li>{@code jobqueue.jobs.retried}: failed attempts left for redelivery</li>
 *   <li>{@code jobqueue.jobs.reclaimed}: stale or orphaned jobs taken over</li>
 *   <li>{@code jobqueue.messages.archived}: messages moved to the archive</li>
 *   <li>{@code jobqueue.messages.redundant}: deliveries dropped as redundant</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code jobqueue.jobs.in.flight}: attempts currently executing</li>
 *   <li>{@code jobqueue.queue.lag.ms}: queue wait of the most recent delivery</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code jobqueue.job.duration}: pipeline execution time per attempt</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter received;
  private final Counter completed;
  private final Counter skipped;
  private final Counter failed;
  private final Counter retried;
  private final Counter reclaimed;
  private final Counter archived;
  private final Counter redundant;
  private final Gauge inFlightGauge;
  private final Gauge lagGauge;
  private final Timer jobDuration;

  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicLong lastLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "jobqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "jobqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * workers in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "media.jobqueue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.received = counter(namePrefix + ".messages.received", "Messages returned by dequeue");
    this.completed = counter(namePrefix + ".jobs.completed", "Jobs finalized COMPLETED");
    this.skipped = counter(namePrefix + ".jobs.skipped", "Jobs finalized SKIPPED");
    this.failed = counter(namePrefix + ".jobs.failed", "Jobs finalized FAILED or TIMED_OUT");
    this.retried = counter(namePrefix + ".jobs.retried", "Failed attempts left for redelivery");
    this.reclaimed = counter(namePrefix + ".jobs.reclaimed", "Stale or orphaned jobs taken over");
    this.archived = counter(namePrefix + ".messages.archived", "Messages moved to the archive");
    this.redundant = counter(namePrefix + ".messages.redundant", "Deliveries dropped as redundant");

    this.inFlightGauge = Gauge.builder(namePrefix + ".jobs.in.flight", inFlight, AtomicInteger::get)
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".queue.lag.ms", lastLagMs, AtomicLong::get)
        .register(registry);
    this.jobDuration = Timer.builder(namePrefix + ".job.duration")
        .description("Pipeline execution time per attempt")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementMessagesReceived(int count) {
    if (closed) return;
    received.increment(count);
  }

  @Override
  public void incrementJobsCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementJobsSkipped() {
    if (closed) return;
    skipped.increment();
  }

  @Override
  public void incrementJobsFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementRetries() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementArchived() {
    if (closed) return;
    archived.increment();
  }

  @Override
  public void incrementRedundant() {
    if (closed) return;
    redundant.increment();
  }

  @Override
  public void incrementReclaimed() {
    if (closed) return;
    reclaimed.increment();
  }

  @Override
  public void recordInFlight(int inFlight) {
    if (closed) return;
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordQueueLagMs(long lagMs) {
    if (closed) return;
    lastLagMs.set(lagMs);
  }

  @Override
  public void recordJobDurationMs(long durationMs) {
    if (closed) return;
    jobDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the worker is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(received, completed, skipped, failed, retried, reclaimed,
        archived, redundant, inFlightGauge, lagGauge, jobDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
