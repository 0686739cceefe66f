package jobqueue;

import jobqueue.model.JobClaim;
import jobqueue.model.JobKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KindRoutingPipelineTest {
  private final JobClaim claim = new JobClaim("job", "token", "worker-1", Instant.now(), 1);

  @Test
  void routesByKind() throws Exception {
    KindRoutingPipeline pipeline = new KindRoutingPipeline()
        .register(JobKind.TRANSCRIPTION, (payload, c) -> JobOutcome.completed("\"t\""))
        .register(JobKind.SCREENSHOT, (payload, c) -> JobOutcome.completed("\"s\""));

    assertEquals("\"t\"", pipeline.process(TranscriptionPayload.of("d-1"), claim).detail());
    assertEquals("\"s\"", pipeline.process(
        new ScreenshotPayload("t-1", "https://v", List.of("1"), 2, null), claim).detail());
  }

  @Test
  void unregisteredKindIsNonRetryable() {
    KindRoutingPipeline pipeline = new KindRoutingPipeline()
        .register(JobKind.TRANSCRIPTION, (payload, c) -> JobOutcome.completed(null));

    assertTrue(pipeline.supports(JobKind.TRANSCRIPTION));
    assertFalse(pipeline.supports(JobKind.SCREENSHOT));
    assertThrows(NonRetryableJobException.class, () -> pipeline.process(
        new ScreenshotPayload("t-1", "https://v", List.of("1"), 2, null), claim));
  }
}
