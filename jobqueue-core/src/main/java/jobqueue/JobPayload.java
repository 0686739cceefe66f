package jobqueue;

import jobqueue.model.JobKind;
import jobqueue.util.JsonCodec;

import java.util.Map;

/**
 * Validated body of a job message. Instances only exist for payloads that passed
 * {@link PayloadDecoder}, so a pipeline never sees a half-formed job.
 *
 * @see TranscriptionPayload
 * @see ScreenshotPayload
 */
public sealed interface JobPayload permits TranscriptionPayload, ScreenshotPayload {

  /** Width of the {@code job_id} column; longer ids are rejected when the payload is built. */
  int MAX_JOB_ID_LENGTH = 255;

  JobKind kind();

  /**
   * Stable identifier of the job record this payload refers to,
   * {@code <kind>:<reference>}. Redundant deliveries of the same work map to the same id.
   */
  String jobId();

  /** Wire fields in the order they are written. */
  Map<String, Object> toMap();

  default String toJson(JsonCodec jsonCodec) {
    return jsonCodec.toJson(toMap());
  }
}
