package jobqueue;

import jobqueue.model.JobClaim;
import jobqueue.model.JobKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Routes each job to the pipeline registered for its {@link JobKind}.
 *
 * <pre>{@code
 * ProcessingPipeline pipeline = new KindRoutingPipeline()
 *     .register(JobKind.TRANSCRIPTION, transcriber)
 *     .register(JobKind.SCREENSHOT, screenshotter);
 * }</pre>
 *
 * <p>A job whose kind has no pipeline fails with {@link NonRetryableJobException}.
 * Register all pipelines before handing the router to a worker.
 */
public final class KindRoutingPipeline implements ProcessingPipeline {
  private final Map<JobKind, ProcessingPipeline> pipelines = new EnumMap<>(JobKind.class);

  public KindRoutingPipeline register(JobKind kind, ProcessingPipeline pipeline) {
    pipelines.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(pipeline, "pipeline"));
    return this;
  }

  public boolean supports(JobKind kind) {
    return pipelines.containsKey(kind);
  }

  @Override
  public JobOutcome process(JobPayload payload, JobClaim claim) throws Exception {
    ProcessingPipeline pipeline = pipelines.get(payload.kind());
    if (pipeline == null) {
      throw new NonRetryableJobException("No pipeline registered for job kind " + payload.kind().wireName());
    }
    return pipeline.process(payload, claim);
  }
}
