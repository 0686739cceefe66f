package jobqueue.purge;

import jobqueue.spi.JobPurger;
import jobqueue.worker.StubConnections;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobPurgeSchedulerTest {

  private static final class CountingPurger implements JobPurger {
    private int remaining;
    final List<Instant> cutoffs = new ArrayList<>();

    CountingPurger(int remaining) {
      this.remaining = remaining;
    }

    @Override
    public int purge(Connection conn, Instant before, int limit) {
      cutoffs.add(before);
      int deleted = Math.min(remaining, limit);
      remaining -= deleted;
      return deleted;
    }
  }

  @Test
  void runOnceDeletesInBatchesUntilDrained() {
    Instant now = Instant.parse("2024-06-01T00:00:00Z");
    CountingPurger purger = new CountingPurger(25);
    JobPurgeScheduler scheduler = JobPurgeScheduler.builder()
        .connectionProvider(StubConnections.provider())
        .purger(purger)
        .retention(Duration.ofDays(7))
        .batchSize(10)
        .clock(Clock.fixed(now, ZoneOffset.UTC))
        .build();

    assertEquals(25, scheduler.runOnce());

    assertEquals(3, purger.cutoffs.size());
    assertEquals(Instant.parse("2024-05-25T00:00:00Z"), purger.cutoffs.get(0));
    scheduler.close();
  }

  @Test
  void connectionFailureDeletesNothing() {
    JobPurgeScheduler scheduler = JobPurgeScheduler.builder()
        .connectionProvider(StubConnections.failing())
        .purger(new CountingPurger(5))
        .build();

    assertEquals(0, scheduler.runOnce());
  }

  @Test
  void startIsIdempotentAndStartAfterCloseThrows() {
    JobPurgeScheduler scheduler = JobPurgeScheduler.builder()
        .connectionProvider(StubConnections.provider())
        .purger(new CountingPurger(0))
        .interval(Duration.ofMinutes(5))
        .build();
    scheduler.start();
    scheduler.start();
    scheduler.close();

    assertThrows(IllegalStateException.class, scheduler::start);
    assertEquals(0, scheduler.runOnce());
  }

  @Test
  void builderValidates() {
    assertThrows(IllegalArgumentException.class, () -> JobPurgeScheduler.builder()
        .connectionProvider(StubConnections.provider())
        .purger(new CountingPurger(0))
        .batchSize(0)
        .build());
    assertThrows(IllegalArgumentException.class, () -> JobPurgeScheduler.builder()
        .connectionProvider(StubConnections.provider())
        .purger(new CountingPurger(0))
        .retention(Duration.ofDays(-1))
        .build());
    assertThrows(NullPointerException.class, () -> JobPurgeScheduler.builder()
        .connectionProvider(StubConnections.provider())
        .build());
  }
}
