package jobqueue.model;

/**
 * Kind of work a job record describes. The wire name appears in message payloads
 * ({@code "kind"}) and as the prefix of job ids.
 */
public enum JobKind {
  TRANSCRIPTION("transcription"),
  SCREENSHOT("screenshot");

  private final String wireName;

  JobKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name, case-insensitively.
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static JobKind fromWireName(String name) {
    if (name != null) {
      for (JobKind kind : values()) {
        if (kind.wireName.equalsIgnoreCase(name.trim())) {
          return kind;
        }
      }
    }
    throw new IllegalArgumentException("Unknown job kind: " + name);
  }
}
