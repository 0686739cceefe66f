package jobqueue;

import jobqueue.model.JobKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extract frames from a transcribed video.
 *
 * @param transcriptionId transcription whose screenshots are produced (required)
 * @param videoUrl        source video (required)
 * @param timestamps      SRT-style positions such as {@code 00:01:00,000}; 1 to {@value #MAX_TIMESTAMPS} entries
 * @param quality         JPEG quality scale, 1 (best) to 31
 * @param documentId      owning document, or {@code null}
 */
public record ScreenshotPayload(
    String transcriptionId,
    String videoUrl,
    List<String> timestamps,
    int quality,
    String documentId
) implements JobPayload {

  public static final int MAX_TIMESTAMPS = 100;
  public static final int DEFAULT_QUALITY = 2;
  public static final int MIN_QUALITY = 1;
  public static final int MAX_QUALITY = 31;

  public ScreenshotPayload {
    Objects.requireNonNull(transcriptionId, "transcriptionId");
    Objects.requireNonNull(videoUrl, "videoUrl");
    Objects.requireNonNull(timestamps, "timestamps");
    if (transcriptionId.isBlank()) {
      throw new IllegalArgumentException("transcriptionId must not be blank");
    }
    int maxLength = MAX_JOB_ID_LENGTH - JobKind.SCREENSHOT.wireName().length() - 1;
    if (transcriptionId.length() > maxLength) {
      throw new IllegalArgumentException(
          "transcriptionId too long (" + transcriptionId.length() + " chars), maximum " + maxLength);
    }
    if (videoUrl.isBlank()) {
      throw new IllegalArgumentException("videoUrl must not be blank");
    }
    if (timestamps.isEmpty()) {
      throw new IllegalArgumentException("timestamps must not be empty");
    }
    if (timestamps.size() > MAX_TIMESTAMPS) {
      throw new IllegalArgumentException(
          "Too many timestamps (" + timestamps.size() + "), maximum " + MAX_TIMESTAMPS);
    }
    if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
      throw new IllegalArgumentException("quality must be in [1, 31], got: " + quality);
    }
    timestamps = List.copyOf(timestamps);
  }

  @Override
  public JobKind kind() {
    return JobKind.SCREENSHOT;
  }

  @Override
  public String jobId() {
    return JobKind.SCREENSHOT.wireName() + ":" + transcriptionId;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", kind().wireName());
    map.put("transcription_id", transcriptionId);
    map.put("video_url", videoUrl);
    map.put("timestamps", timestamps);
    map.put("quality", quality);
    if (documentId != null) {
      map.put("document_id", documentId);
    }
    return map;
  }
}
