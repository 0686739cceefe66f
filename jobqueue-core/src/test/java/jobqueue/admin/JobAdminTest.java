package jobqueue.admin;

import jobqueue.JobOutcome;
import jobqueue.TranscriptionPayload;
import jobqueue.model.JobClaim;
import jobqueue.model.JobRecord;
import jobqueue.model.JobStatus;
import jobqueue.worker.StubConnections;
import jobqueue.worker.StubJobStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobAdminTest {
  private final StubJobStore store = new StubJobStore();
  private final JobAdmin admin = new JobAdmin(StubConnections.provider(), store);

  private String finish(String documentId, JobOutcome outcome) {
    TranscriptionPayload payload = TranscriptionPayload.of(documentId);
    Instant now = Instant.now();
    store.registerIfAbsent(null, payload, now);
    JobClaim claim = store.claim(null, payload.jobId(), "worker-1", now, Duration.ofMinutes(35)).orElseThrow();
    assertTrue(store.finalize(null, claim, outcome, now));
    return payload.jobId();
  }

  @Test
  void resetPreservesHistoryByDefault() {
    String jobId = finish("doc-1", JobOutcome.completed("{\"words\":3}"));

    assertTrue(admin.reset(jobId));

    JobRecord record = admin.find(jobId).orElseThrow();
    assertEquals(JobStatus.UNCLAIMED, record.status());
    assertEquals(0, record.attemptCount());
    assertEquals("{\"words\":3}", record.result());
    assertEquals(1, record.completedCount());
  }

  @Test
  void resetWithoutHistoryClearsResult() {
    String jobId = finish("doc-1", JobOutcome.completed("{\"words\":3}"));

    assertTrue(admin.reset(jobId, false));

    JobRecord record = admin.find(jobId).orElseThrow();
    assertNull(record.result());
    assertEquals(0, record.completedCount());
  }

  @Test
  void resetUnknownJobReturnsFalse() {
    assertFalse(admin.reset("transcription:missing"));
    assertTrue(admin.find("transcription:missing").isEmpty());
  }

  @Test
  void resetAllResetsEveryFailedJob() {
    finish("doc-1", new JobOutcome.Failed("boom"));
    finish("doc-2", new JobOutcome.Failed("boom"));
    finish("doc-3", new JobOutcome.Failed("boom"));
    finish("doc-4", JobOutcome.completed(null));

    assertEquals(3, admin.count(JobStatus.FAILED));
    assertEquals(3, admin.resetAll(JobStatus.FAILED, 2));

    assertEquals(0, admin.count(JobStatus.FAILED));
    assertEquals(3, admin.count(JobStatus.UNCLAIMED));
    assertEquals(1, admin.count(JobStatus.COMPLETED));
    assertEquals(4, admin.count(null));
  }

  @Test
  void resetAllRejectsUnclaimed() {
    assertThrows(IllegalArgumentException.class, () -> admin.resetAll(JobStatus.UNCLAIMED, 10));
    assertThrows(IllegalArgumentException.class, () -> admin.resetAll(JobStatus.FAILED, 0));
  }

  @Test
  void queryFiltersByStatus() {
    finish("doc-1", new JobOutcome.Failed("boom"));
    finish("doc-2", JobOutcome.completed(null));

    List<JobRecord> failed = admin.query(JobStatus.FAILED, 10);

    assertEquals(1, failed.size());
    assertEquals("transcription:doc-1", failed.get(0).jobId());
    assertEquals("boom", failed.get(0).lastError());
  }

  @Test
  void connectionFailureReturnsEmptyResults() {
    JobAdmin broken = new JobAdmin(StubConnections.failing(), store);

    assertTrue(broken.find("transcription:doc-1").isEmpty());
    assertTrue(broken.query(JobStatus.FAILED, 10).isEmpty());
    assertEquals(0, broken.count(null));
    assertFalse(broken.reset("transcription:doc-1"));
    assertEquals(0, broken.resetAll(JobStatus.FAILED, 10));
  }
}
