package jobqueue;

import jobqueue.model.JobKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Transcribe the media behind a document.
 *
 * @param documentId the document to transcribe (required)
 * @param language   language hint, or {@code null} to auto-detect
 */
public record TranscriptionPayload(String documentId, String language) implements JobPayload {

  public TranscriptionPayload {
    Objects.requireNonNull(documentId, "documentId");
    if (documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    int maxLength = MAX_JOB_ID_LENGTH - JobKind.TRANSCRIPTION.wireName().length() - 1;
    if (documentId.length() > maxLength) {
      throw new IllegalArgumentException(
          "documentId too long (" + documentId.length() + " chars), maximum " + maxLength);
    }
  }

  public static TranscriptionPayload of(String documentId) {
    return new TranscriptionPayload(documentId, null);
  }

  @Override
  public JobKind kind() {
    return JobKind.TRANSCRIPTION;
  }

  @Override
  public String jobId() {
    return JobKind.TRANSCRIPTION.wireName() + ":" + documentId;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", kind().wireName());
    map.put("document_id", documentId);
    if (language != null) {
      map.put("language", language);
    }
    return map;
  }
}
