package jobqueue.jdbc;

import jobqueue.model.QueueMessage;
import jobqueue.spi.QueueGateway;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Queue double with visibility timeouts and read counts, for driving the worker
 * against a real job store.
 */
class InMemoryQueueGateway implements QueueGateway {

  private static final class Entry {
    final String payload;
    final Instant enqueuedAt;
    int readCount;
    Instant visibleAt;

    Entry(String payload, Instant enqueuedAt, Instant visibleAt) {
      this.payload = payload;
      this.enqueuedAt = enqueuedAt;
      this.visibleAt = visibleAt;
    }
  }

  private final Map<Long, Entry> live = new LinkedHashMap<>();
  private long nextId = 1;
  final List<Long> deleted = new CopyOnWriteArrayList<>();
  final List<Long> archived = new CopyOnWriteArrayList<>();

  @Override
  public synchronized long send(String payloadJson, Duration delay) {
    long id = nextId++;
    Instant now = Instant.now();
    live.put(id, new Entry(payloadJson, now, now.plus(delay)));
    return id;
  }

  @Override
  public synchronized List<QueueMessage> dequeue(Duration visibility, int maxCount) {
    Instant now = Instant.now();
    List<QueueMessage> result = new ArrayList<>();
    for (Map.Entry<Long, Entry> e : live.entrySet()) {
      Entry entry = e.getValue();
      if (result.size() < maxCount && !entry.visibleAt.isAfter(now)) {
        entry.readCount++;
        entry.visibleAt = now.plus(visibility);
        result.add(new QueueMessage(e.getKey(), entry.readCount, entry.payload, entry.enqueuedAt, entry.visibleAt));
      }
    }
    return result;
  }

  @Override
  public synchronized void ackDelete(long messageId) {
    if (live.remove(messageId) != null) {
      deleted.add(messageId);
    }
  }

  @Override
  public synchronized void ackArchive(long messageId) {
    if (live.remove(messageId) != null) {
      archived.add(messageId);
    }
  }

  /** Simulates the visibility timeout running out for every hidden message. */
  synchronized void expireVisibility() {
    Instant now = Instant.now();
    for (Entry entry : live.values()) {
      entry.visibleAt = now;
    }
  }

  synchronized boolean isLive(long messageId) {
    return live.containsKey(messageId);
  }
}
