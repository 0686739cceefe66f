package jobqueue.worker;

/**
 * What {@link WorkerLoop#process} did with a delivery.
 */
public enum MessageDisposition {
  /** Removed from the queue: the job finished, or another worker owns it. */
  DELETED,
  /** Moved to the queue archive: malformed, failed permanently, or out of retries. */
  ARCHIVED,
  /** Not acknowledged: the message reappears after the visibility timeout. */
  RETAINED
}
