package jobqueue;

import jobqueue.model.JobKind;
import jobqueue.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a raw message body into a validated {@link JobPayload}.
 *
 * <p>Accepted shapes:
 * <pre>{@code
 * {"kind":"transcription","document_id":"d-1","language":"en"}
 * {"document_id":"d-1"}                                  // no kind: transcription
 * {"message":{"document_id":"d-1"}}                      // wrapped body
 * {"kind":"screenshot","transcription_id":"t-1","video_url":"https://...",
 *  "timestamps":["00:00:30,000"],"quality":2,"document_id":"d-1"}
 * }</pre>
 *
 * <p>A screenshot {@code quality} that is missing, not an integer, or outside 1..31
 * falls back to {@value ScreenshotPayload#DEFAULT_QUALITY}. Everything else that
 * does not fit throws {@link MalformedPayloadException}, including references whose
 * job id would exceed {@link JobPayload#MAX_JOB_ID_LENGTH}.
 */
public final class PayloadDecoder {
  private final JsonCodec jsonCodec;

  public PayloadDecoder() {
    this(JsonCodec.getDefault());
  }

  public PayloadDecoder(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Decodes a message body.
   *
   * @param json the message body
   * @return the validated payload
   * @throws MalformedPayloadException if the body is not a valid job payload
   */
  public JobPayload decode(String json) {
    Map<String, Object> fields;
    try {
      fields = jsonCodec.parseObject(json);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException("Unparseable payload: " + e.getMessage(), e);
    }
    if (fields.isEmpty()) {
      throw new MalformedPayloadException("Empty payload");
    }
    fields = unwrap(fields);

    JobKind kind;
    Object kindValue = fields.get("kind");
    if (kindValue == null) {
      kind = JobKind.TRANSCRIPTION;
    } else if (kindValue instanceof String name) {
      try {
        kind = JobKind.fromWireName(name);
      } catch (IllegalArgumentException e) {
        throw new MalformedPayloadException(e.getMessage(), e);
      }
    } else {
      throw new MalformedPayloadException("Field 'kind' must be a string");
    }

    try {
      switch (kind) {
        case TRANSCRIPTION:
          return new TranscriptionPayload(
              requiredString(fields, "document_id"),
              optionalString(fields, "language"));
        case SCREENSHOT:
          return new ScreenshotPayload(
              requiredString(fields, "transcription_id"),
              requiredString(fields, "video_url"),
              timestamps(fields.get("timestamps")),
              quality(fields.get("quality")),
              optionalString(fields, "document_id"));
        default:
          throw new MalformedPayloadException("Unsupported job kind: " + kind);
      }
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException(e.getMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> unwrap(Map<String, Object> fields) {
    Object inner = fields.get("message");
    if (inner instanceof Map<?, ?> && !fields.containsKey("kind") && !fields.containsKey("document_id")) {
      return (Map<String, Object>) inner;
    }
    return fields;
  }

  private static String requiredString(Map<String, Object> fields, String name) {
    Object value = fields.get(name);
    if (value == null) {
      throw new MalformedPayloadException("Missing required field '" + name + "'");
    }
    if (!(value instanceof String s) || s.isBlank()) {
      throw new MalformedPayloadException("Field '" + name + "' must be a non-empty string");
    }
    return s;
  }

  private static String optionalString(Map<String, Object> fields, String name) {
    Object value = fields.get(name);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String s)) {
      throw new MalformedPayloadException("Field '" + name + "' must be a string");
    }
    return s.isBlank() ? null : s;
  }

  private static List<String> timestamps(Object value) {
    if (value == null) {
      throw new MalformedPayloadException("No timestamps provided");
    }
    if (!(value instanceof List<?> items)) {
      throw new MalformedPayloadException("Field 'timestamps' must be an array");
    }
    List<String> result = new ArrayList<>(items.size());
    for (Object item : items) {
      if (item instanceof String s && !s.isBlank()) {
        result.add(s);
      } else if (item instanceof Number n) {
        result.add(n.toString());
      } else {
        throw new MalformedPayloadException("Invalid timestamp: " + item);
      }
    }
    return result;
  }

  private static int quality(Object value) {
    if (value instanceof Long || value instanceof Integer) {
      long n = ((Number) value).longValue();
      if (n >= ScreenshotPayload.MIN_QUALITY && n <= ScreenshotPayload.MAX_QUALITY) {
        return (int) n;
      }
    }
    return ScreenshotPayload.DEFAULT_QUALITY;
  }
}
