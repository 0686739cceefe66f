package jobqueue.worker;

import jobqueue.JobOutcome;
import jobqueue.ProcessingPipeline;
import jobqueue.TranscriptionPayload;
import jobqueue.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StuckJobReclaimerTest {
  private final StubJobStore store = new StubJobStore();

  private StuckJobReclaimer reclaimer(ProcessingPipeline pipeline, Duration skipRecent) {
    WorkerConfig config = WorkerConfig.builder()
        .maxRetries(5)
        .visibility(Duration.ofMinutes(30))
        .stalenessThreshold(Duration.ofMinutes(35))
        .ownerId("reclaimer-test")
        .build();
    return StuckJobReclaimer.builder()
        .connectionProvider(StubConnections.provider())
        .jobStore(store)
        .scanner(store)
        .pipeline(pipeline)
        .config(config)
        .skipRecent(skipRecent)
        .build();
  }

  /** Reclaimer with the default grace period, which is the visibility timeout. */
  private StuckJobReclaimer reclaimerAt(ProcessingPipeline pipeline, Clock clock) {
    return StuckJobReclaimer.builder()
        .connectionProvider(StubConnections.provider())
        .jobStore(store)
        .scanner(store)
        .pipeline(pipeline)
        .config(WorkerConfig.builder()
            .maxRetries(5)
            .visibility(Duration.ofMinutes(30))
            .stalenessThreshold(Duration.ofMinutes(35))
            .ownerId("reclaimer-test")
            .build())
        .clock(clock)
        .build();
  }

  private String register(String documentId, Instant createdAt) {
    TranscriptionPayload payload = TranscriptionPayload.of(documentId);
    store.registerIfAbsent(null, payload, createdAt);
    return payload.jobId();
  }

  @Test
  void reclaimsUnclaimedAndStaleJobs() {
    Instant now = Instant.now();
    String orphan = register("doc-1", now.minus(Duration.ofMinutes(10)));
    String stale = register("doc-2", now.minus(Duration.ofHours(1)));
    store.claimAs(stale, "worker-dead", now.minus(Duration.ofMinutes(40)));
    String fresh = register("doc-3", now.minus(Duration.ofHours(1)));
    store.claimAs(fresh, "worker-alive", now.minus(Duration.ofMinutes(5)));

    List<String> processed = new ArrayList<>();
    try (StuckJobReclaimer reclaimer = reclaimer((payload, claim) -> {
      processed.add(payload.jobId());
      return JobOutcome.completed("{}");
    }, Duration.ZERO)) {
      assertEquals(2, reclaimer.reclaimOnce());
      assertEquals(2, reclaimer.status().reclaimed());
      assertEquals(2, reclaimer.status().completed());
    }

    assertEquals(List.of(stale, orphan), processed);
    assertEquals(JobStatus.COMPLETED, store.row(orphan).status);
    assertEquals(JobStatus.COMPLETED, store.row(stale).status);
    assertEquals(2, store.row(stale).attemptCount);
    assertEquals("worker-alive", store.row(fresh).claimedBy);
    assertEquals(JobStatus.CLAIMED, store.row(fresh).status);
  }

  @Test
  void skipsRecentlyCreatedJobs() {
    Instant now = Instant.now();
    String recent = register("doc-1", now);

    try (StuckJobReclaimer reclaimer = reclaimer((payload, claim) -> JobOutcome.completed(null),
        Duration.ofMinutes(5))) {
      assertEquals(0, reclaimer.reclaimOnce());
    }
    assertEquals(JobStatus.UNCLAIMED, store.row(recent).status);
  }

  @Test
  void failsJobWhenAttemptsAreExhausted() {
    Instant longAgo = Instant.now().minus(Duration.ofHours(2));
    String jobId = register("doc-1", longAgo);
    for (int i = 0; i < 4; i++) {
      store.claimAs(jobId, "worker-crashing", longAgo);
    }

    try (StuckJobReclaimer reclaimer = reclaimer((payload, claim) -> {
      assertEquals(5, claim.attempt());
      throw new IllegalStateException("out of memory");
    }, Duration.ZERO)) {
      assertEquals(1, reclaimer.reclaimOnce());
      assertEquals(1, reclaimer.status().failed());
    }

    StubJobStore.Row row = store.row(jobId);
    assertEquals(JobStatus.FAILED, row.status);
    assertEquals("Failed after 5 attempts. Last error: out of memory", row.lastError);
  }

  @Test
  void transientFailureBeforeExhaustionYields() {
    String jobId = register("doc-1", Instant.now().minus(Duration.ofHours(1)));

    try (StuckJobReclaimer reclaimer = reclaimer((payload, claim) -> {
      throw new IllegalStateException("busy");
    }, Duration.ZERO)) {
      assertEquals(1, reclaimer.reclaimOnce());
    }

    StubJobStore.Row row = store.row(jobId);
    assertEquals(JobStatus.CLAIMED, row.status);
    assertTrue(row.yielded);
    assertEquals("reclaimer-test", row.claimedBy);
  }

  @Test
  void yieldedRetryIsPickedUpAfterGracePeriodNotThreshold() {
    Instant t0 = Instant.parse("2024-06-03T10:00:00Z");
    String jobId = register("doc-1", t0.minus(Duration.ofHours(1)));
    AtomicInteger runs = new AtomicInteger();
    ProcessingPipeline flaky = (payload, claim) -> {
      if (runs.incrementAndGet() == 1) {
        throw new IllegalStateException("upstream 503");
      }
      return JobOutcome.completed("{}");
    };

    try (StuckJobReclaimer reclaimer = reclaimerAt(flaky, Clock.fixed(t0, ZoneOffset.UTC))) {
      assertEquals(1, reclaimer.reclaimOnce());
    }
    assertTrue(store.row(jobId).yielded);

    try (StuckJobReclaimer reclaimer = reclaimerAt(flaky, Clock.fixed(t0.plus(Duration.ofMinutes(10)), ZoneOffset.UTC))) {
      assertEquals(0, reclaimer.reclaimOnce());
    }
    // visibility (30m) has passed, the staleness threshold (35m) has not
    try (StuckJobReclaimer reclaimer = reclaimerAt(flaky, Clock.fixed(t0.plus(Duration.ofMinutes(31)), ZoneOffset.UTC))) {
      assertEquals(1, reclaimer.reclaimOnce());
    }

    StubJobStore.Row row = store.row(jobId);
    assertEquals(JobStatus.COMPLETED, row.status);
    assertEquals(2, row.attemptCount);
    assertEquals(2, runs.get());
  }

  @Test
  void defaultGracePeriodLeavesFreshSubmissionsToTheQueue() {
    Instant t0 = Instant.parse("2024-06-03T10:00:00Z");
    String jobId = register("doc-1", t0);

    try (StuckJobReclaimer reclaimer = reclaimerAt((payload, claim) -> JobOutcome.completed(null),
        Clock.fixed(t0.plus(Duration.ofMinutes(29)), ZoneOffset.UTC))) {
      assertEquals(0, reclaimer.reclaimOnce());
    }
    assertEquals(JobStatus.UNCLAIMED, store.row(jobId).status);
  }

  @Test
  void scanFailureIsLoggedAndIgnored() {
    try (StuckJobReclaimer reclaimer = StuckJobReclaimer.builder()
        .connectionProvider(StubConnections.failing())
        .jobStore(store)
        .scanner(store)
        .pipeline((payload, claim) -> JobOutcome.completed(null))
        .build()) {
      assertEquals(0, reclaimer.reclaimOnce());
    }
  }

  @Test
  void startIsIdempotentAndStartAfterCloseThrows() {
    StuckJobReclaimer reclaimer = reclaimer((payload, claim) -> JobOutcome.completed(null), Duration.ZERO);
    reclaimer.start();
    reclaimer.start();
    assertTrue(reclaimer.status().running());
    reclaimer.close();

    assertThrows(IllegalStateException.class, reclaimer::start);
    assertEquals(0, reclaimer.reclaimOnce());
  }

  @Test
  void builderRejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class, () -> StuckJobReclaimer.builder()
        .connectionProvider(StubConnections.provider())
        .jobStore(store)
        .scanner(store)
        .pipeline((payload, claim) -> JobOutcome.completed(null))
        .interval(Duration.ZERO)
        .build());
  }
}
