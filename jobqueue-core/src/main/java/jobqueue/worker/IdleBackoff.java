package jobqueue.worker;

import java.time.Duration;
import java.util.Objects;

/**
 * Sleep schedule for an idle worker: starts at {@code initial}, doubles after every
 * consecutive empty poll, and is capped at {@code max}. {@link #reset()} after work
 * was found.
 *
 * <p>Not thread-safe; owned by the polling thread.
 */
public final class IdleBackoff {
  private final Duration initial;
  private final Duration max;
  private Duration current;

  public IdleBackoff(Duration initial, Duration max) {
    this.initial = Objects.requireNonNull(initial, "initial");
    this.max = Objects.requireNonNull(max, "max");
    if (initial.isNegative() || initial.isZero()) {
      throw new IllegalArgumentException("initial must be positive");
    }
    if (max.compareTo(initial) < 0) {
      throw new IllegalArgumentException("max must be >= initial");
    }
    this.current = initial;
  }

  /** Returns the sleep for this empty poll and advances the schedule. */
  public Duration next() {
    Duration sleep = current;
    Duration doubled = current.multipliedBy(2);
    current = doubled.compareTo(max) > 0 ? max : doubled;
    return sleep;
  }

  /** The sleep {@link #next()} would return, without advancing. */
  public Duration peek() {
    return current;
  }

  public void reset() {
    current = initial;
  }
}
