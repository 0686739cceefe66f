package jobqueue.jdbc;

import jobqueue.JobOutcome;
import jobqueue.ScreenshotPayload;
import jobqueue.TranscriptionPayload;
import jobqueue.jdbc.purge.AbstractJdbcJobPurger;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.model.JobClaim;
import jobqueue.model.JobKind;
import jobqueue.model.JobRecord;
import jobqueue.model.JobStatus;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Job store behaviour shared by every dialect. Subclasses provide the DataSource,
 * store and purger, with an empty {@code job_record} table before each test.
 */
abstract class AbstractJobStoreIntegrationTest {
  static final Instant T0 = Instant.parse("2024-06-03T10:15:30.123Z");
  static final Duration THETA = Duration.ofSeconds(60);

  abstract DataSource dataSource();

  abstract AbstractJdbcJobStore store();

  abstract AbstractJdbcJobPurger purger();

  private Connection open() throws Exception {
    Connection conn = dataSource().getConnection();
    conn.setAutoCommit(true);
    return conn;
  }

  private String register(Connection conn, String documentId, Instant at) {
    TranscriptionPayload payload = TranscriptionPayload.of(documentId);
    store().registerIfAbsent(conn, payload, at);
    return payload.jobId();
  }

  @Test
  void registerIsIdempotent() throws Exception {
    try (Connection conn = open()) {
      TranscriptionPayload payload = new TranscriptionPayload("doc-1", "en");
      assertTrue(store().registerIfAbsent(conn, payload, T0));
      assertFalse(store().registerIfAbsent(conn, payload, T0.plusSeconds(5)));

      JobRecord record = store().find(conn, payload.jobId()).orElseThrow();
      assertEquals(JobKind.TRANSCRIPTION, record.kind());
      assertEquals(JobStatus.UNCLAIMED, record.status());
      assertEquals(0, record.attemptCount());
      assertEquals(T0, record.createdAt());
      assertTrue(record.payloadJson().contains("\"document_id\":\"doc-1\""));
    }
  }

  @Test
  void claimHonoursStalenessThreshold() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);

      Optional<JobClaim> first = store().claim(conn, jobId, "worker-a", T0, THETA);
      assertTrue(first.isPresent());
      assertEquals(1, first.get().attempt());

      assertTrue(store().claim(conn, jobId, "worker-b", T0, THETA).isEmpty());
      assertTrue(store().claim(conn, jobId, "worker-b", T0.plus(THETA), THETA).isEmpty());

      Optional<JobClaim> takeover = store().claim(conn, jobId, "worker-b", T0.plusSeconds(61), THETA);
      assertTrue(takeover.isPresent());
      assertEquals(2, takeover.get().attempt());
      assertNotEquals(first.get().token(), takeover.get().token());

      JobRecord record = store().find(conn, jobId).orElseThrow();
      assertEquals("worker-b", record.claimedBy());
      assertEquals(T0.plusSeconds(61), record.claimedAt());
    }
  }

  @Test
  void claimOfUnknownJobIsRefused() throws Exception {
    try (Connection conn = open()) {
      assertTrue(store().claim(conn, "transcription:missing", "worker-a", T0, THETA).isEmpty());
    }
  }

  @Test
  void concurrentClaimsHaveExactlyOneWinner() throws Exception {
    String jobId;
    try (Connection conn = open()) {
      jobId = register(conn, "doc-race", T0);
    }
    int workers = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(workers);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        String owner = "worker-" + i;
        Callable<Boolean> attempt = () -> {
          start.await();
          try (Connection conn = open()) {
            return store().claim(conn, jobId, owner, T0.plusSeconds(1), THETA).isPresent();
          }
        };
        results.add(pool.submit(attempt));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(30, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertEquals(1, winners);
    } finally {
      pool.shutdownNow();
    }
    try (Connection conn = open()) {
      assertEquals(1, store().find(conn, jobId).orElseThrow().attemptCount());
    }
  }

  @Test
  void finalizeRecordsOutcome() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      JobClaim claim = store().claim(conn, jobId, "worker-a", T0, THETA).orElseThrow();

      assertTrue(store().finalize(conn, claim, JobOutcome.completed("{\"segments\":4}"), T0.plusSeconds(30)));

      JobRecord record = store().find(conn, jobId).orElseThrow();
      assertEquals(JobStatus.COMPLETED, record.status());
      assertEquals("{\"segments\":4}", record.result());
      assertEquals(1, record.completedCount());
      assertEquals(T0.plusSeconds(30), record.finishedAt());
      assertTrue(store().claim(conn, jobId, "worker-b", T0.plus(Duration.ofDays(1)), THETA).isEmpty());
    }
  }

  @Test
  void finalizeWithSupersededTokenIsRefused() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      JobClaim stale = store().claim(conn, jobId, "worker-a", T0, THETA).orElseThrow();
      JobClaim fresh = store().claim(conn, jobId, "worker-b", T0.plusSeconds(61), THETA).orElseThrow();

      assertFalse(store().finalize(conn, stale, new JobOutcome.Failed("late failure"), T0.plusSeconds(62)));
      assertFalse(store().yieldClaim(conn, stale, "late retry", T0.plusSeconds(62)));
      assertTrue(store().finalize(conn, fresh, JobOutcome.skipped("nothing to do"), T0.plusSeconds(63)));

      JobRecord record = store().find(conn, jobId).orElseThrow();
      assertEquals(JobStatus.SKIPPED, record.status());
      assertNull(record.lastError());
    }
  }

  @Test
  void yieldedClaimCanBeReclaimedImmediately() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      JobClaim first = store().claim(conn, jobId, "worker-a", T0, THETA).orElseThrow();

      assertTrue(store().yieldClaim(conn, first, "Retry 1/5: timeout", T0.plusSeconds(1)));
      JobRecord yielded = store().find(conn, jobId).orElseThrow();
      assertEquals(JobStatus.CLAIMED, yielded.status());
      assertTrue(yielded.claimYielded());
      assertEquals("Retry 1/5: timeout", yielded.lastError());

      JobClaim second = store().claim(conn, jobId, "worker-b", T0.plusSeconds(2), THETA).orElseThrow();
      assertEquals(2, second.attempt());
      assertFalse(store().find(conn, jobId).orElseThrow().claimYielded());
    }
  }

  @Test
  void resetReturnsJobToUnclaimed() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      JobClaim claim = store().claim(conn, jobId, "worker-a", T0, THETA).orElseThrow();
      store().finalize(conn, claim, JobOutcome.completed("{\"v\":1}"), T0.plusSeconds(5));

      assertTrue(store().reset(conn, jobId, true, T0.plusSeconds(10)));
      JobRecord kept = store().find(conn, jobId).orElseThrow();
      assertEquals(JobStatus.UNCLAIMED, kept.status());
      assertEquals(0, kept.attemptCount());
      assertNull(kept.claimedBy());
      assertNull(kept.finishedAt());
      assertEquals("{\"v\":1}", kept.result());
      assertEquals(1, kept.completedCount());

      assertTrue(store().reset(conn, jobId, false, T0.plusSeconds(11)));
      JobRecord cleared = store().find(conn, jobId).orElseThrow();
      assertNull(cleared.result());
      assertEquals(0, cleared.completedCount());

      assertTrue(store().claim(conn, jobId, "worker-b", T0.plusSeconds(12), THETA).isPresent());
      assertFalse(store().reset(conn, "transcription:missing", true, T0));
    }
  }

  @Test
  void resetInvalidatesOutstandingClaim() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      JobClaim claim = store().claim(conn, jobId, "worker-a", T0, THETA).orElseThrow();

      store().reset(conn, jobId, true, T0.plusSeconds(1));

      assertFalse(store().finalize(conn, claim, JobOutcome.completed(null), T0.plusSeconds(2)));
      assertEquals(JobStatus.UNCLAIMED, store().find(conn, jobId).orElseThrow().status());
    }
  }

  @Test
  void findReclaimableReturnsStaleAndUnclaimedOldestFirst() throws Exception {
    try (Connection conn = open()) {
      String stale = register(conn, "doc-stale", T0);
      String unclaimed = register(conn, "doc-unclaimed", T0.plusSeconds(10));
      String fresh = register(conn, "doc-fresh", T0.plusSeconds(20));
      String done = register(conn, "doc-done", T0.plusSeconds(30));
      String recent = register(conn, "doc-recent", T0.plusSeconds(295));
      store().claim(conn, stale, "worker-a", T0.plusSeconds(100), THETA);
      store().claim(conn, fresh, "worker-a", T0.plusSeconds(250), THETA);
      JobClaim doneClaim = store().claim(conn, done, "worker-a", T0.plusSeconds(100), THETA).orElseThrow();
      store().finalize(conn, doneClaim, JobOutcome.completed(null), T0.plusSeconds(101));

      Instant now = T0.plusSeconds(300);
      assertEquals(List.of(stale, unclaimed, recent), store().findReclaimable(conn, now, THETA, 10));
      assertEquals(List.of(stale, unclaimed),
          store().findReclaimable(conn, now, THETA, Duration.ofSeconds(30), 10));
      assertEquals(List.of(stale), store().findReclaimable(conn, now, THETA, 1));
      assertFalse(store().findReclaimable(conn, now, THETA, 10).contains(fresh));
    }
  }

  @Test
  void yieldedClaimIsReclaimableAfterGracePeriod() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      JobClaim claim = store().claim(conn, jobId, "reclaimer-a", T0, THETA).orElseThrow();
      store().yieldClaim(conn, claim, "Retry 1/5: upstream 503", T0.plusSeconds(5));

      Duration grace = Duration.ofSeconds(30);
      assertTrue(store().findReclaimable(conn, T0.plusSeconds(20), THETA, grace, 10).isEmpty());
      assertEquals(List.of(jobId), store().findReclaimable(conn, T0.plusSeconds(35), THETA, grace, 10));
    }
  }

  @Test
  void finalizeOfFinishedJobIsRefused() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      JobClaim claim = store().claim(conn, jobId, "worker-a", T0, THETA).orElseThrow();
      assertTrue(store().finalize(conn, claim, JobOutcome.completed(null), T0.plusSeconds(1)));

      assertFalse(store().finalize(conn, claim, new JobOutcome.Failed("late"), T0.plusSeconds(2)));
      assertEquals(JobStatus.COMPLETED, store().find(conn, jobId).orElseThrow().status());
    }
  }

  @Test
  void stuckJobBecomesReclaimableOnlyAfterThreshold() throws Exception {
    try (Connection conn = open()) {
      String jobId = register(conn, "doc-1", T0);
      store().claim(conn, jobId, "worker-crashed", T0, THETA);

      assertTrue(store().findReclaimable(conn, T0.plus(THETA), THETA, 10).isEmpty());
      assertEquals(List.of(jobId), store().findReclaimable(conn, T0.plus(THETA).plusMillis(1), THETA, 10));
    }
  }

  @Test
  void queryAndCountByStatus() throws Exception {
    try (Connection conn = open()) {
      store().registerIfAbsent(conn,
          new ScreenshotPayload("t-1", "https://cdn.example.com/v.mp4", List.of("00:00:01,000"), 2, "d-1"), T0);
      String failed = register(conn, "doc-2", T0.plusSeconds(1));
      JobClaim claim = store().claim(conn, failed, "worker-a", T0.plusSeconds(2), THETA).orElseThrow();
      store().finalize(conn, claim, new JobOutcome.Failed("Video not found"), T0.plusSeconds(3));

      assertEquals(2, store().countByStatus(conn, null));
      assertEquals(1, store().countByStatus(conn, JobStatus.FAILED));
      List<JobRecord> unclaimed = store().queryByStatus(conn, JobStatus.UNCLAIMED, 10);
      assertEquals(1, unclaimed.size());
      assertEquals(JobKind.SCREENSHOT, unclaimed.get(0).kind());
      assertEquals("Video not found", store().queryByStatus(conn, JobStatus.FAILED, 10).get(0).lastError());
      assertEquals(1, store().queryByStatus(conn, null, 1).size());
    }
  }

  @Test
  void purgeDeletesOnlyOldFinishedJobs() throws Exception {
    try (Connection conn = open()) {
      for (int i = 0; i < 5; i++) {
        String jobId = register(conn, "doc-old-" + i, T0);
        JobClaim claim = store().claim(conn, jobId, "worker-a", T0, THETA).orElseThrow();
        store().finalize(conn, claim, JobOutcome.completed(null), T0.plusSeconds(1));
      }
      String recent = register(conn, "doc-recent", T0);
      JobClaim claim = store().claim(conn, recent, "worker-a", T0, THETA).orElseThrow();
      store().finalize(conn, claim, new JobOutcome.Failed("x"), T0.plus(Duration.ofDays(10)));
      String pending = register(conn, "doc-pending", T0);
      String running = register(conn, "doc-running", T0);
      store().claim(conn, running, "worker-a", T0, THETA);

      Instant cutoff = T0.plus(Duration.ofDays(1));
      assertEquals(3, purger().purge(conn, cutoff, 3));
      assertEquals(2, purger().purge(conn, cutoff, 3));
      assertEquals(0, purger().purge(conn, cutoff, 3));

      assertEquals(3, store().countByStatus(conn, null));
      assertTrue(store().find(conn, recent).isPresent());
      assertTrue(store().find(conn, pending).isPresent());
      assertTrue(store().find(conn, running).isPresent());
    }
  }
}
