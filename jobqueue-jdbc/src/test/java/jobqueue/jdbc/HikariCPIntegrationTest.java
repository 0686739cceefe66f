package jobqueue.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobqueue.JobOutcome;
import jobqueue.JobSubmitter;
import jobqueue.TranscriptionPayload;
import jobqueue.admin.JobAdmin;
import jobqueue.jdbc.store.H2JobStore;
import jobqueue.model.JobStatus;
import jobqueue.worker.WorkerConfig;
import jobqueue.worker.WorkerLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private H2JobStore jobStore;
  private DataSourceConnectionProvider connectionProvider;
  private InMemoryQueueGateway queue;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("jobqueue-test-pool");

    hikariDs = new HikariDataSource(config);
    jobStore = new H2JobStore();
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    queue = new InMemoryQueueGateway();

    try (Connection conn = hikariDs.getConnection()) {
      Schemas.apply(conn, "/schema/h2.sql");
    }
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  private WorkerLoop worker(CountDownLatch latch, int concurrency) {
    return WorkerLoop.builder()
        .connectionProvider(connectionProvider)
        .queueGateway(queue)
        .jobStore(jobStore)
        .pipeline((payload, claim) -> {
          latch.countDown();
          return JobOutcome.completed("{}");
        })
        .config(WorkerConfig.builder()
            .concurrency(concurrency)
            .batchSize(10)
            .startupDelay(Duration.ZERO)
            .pollInterval(Duration.ZERO)
            .idleSleep(Duration.ofMillis(20))
            .maxIdleSleep(Duration.ofMillis(100))
            .build())
        .build();
  }

  @Test
  void processJobsThroughPool() throws Exception {
    CountDownLatch latch = new CountDownLatch(20);
    JobSubmitter submitter = new JobSubmitter(connectionProvider, jobStore, queue);
    for (int i = 0; i < 20; i++) {
      submitter.submit(TranscriptionPayload.of("doc-" + i));
    }

    try (WorkerLoop loop = worker(latch, 3)) {
      loop.start();
      assertTrue(latch.await(5, TimeUnit.SECONDS));
      awaitCompleted(20, 3_000);
    }
    assertEquals(20, queue.deleted.size());
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void concurrentSubmittersThroughPool() throws Exception {
    int threads = 4;
    int perThread = 10;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch done = new CountDownLatch(threads);
    AtomicInteger failures = new AtomicInteger();
    JobSubmitter submitter = new JobSubmitter(connectionProvider, jobStore, queue);

    for (int t = 0; t < threads; t++) {
      int thread = t;
      executor.execute(() -> {
        try {
          for (int i = 0; i < perThread; i++) {
            submitter.submit(TranscriptionPayload.of("doc-" + thread + "-" + i));
          }
        } catch (RuntimeException e) {
          failures.incrementAndGet();
        } finally {
          done.countDown();
        }
      });
    }
    assertTrue(done.await(5, TimeUnit.SECONDS));
    executor.shutdown();

    assertEquals(0, failures.get());
    assertEquals(threads * perThread, new JobAdmin(connectionProvider, jobStore).count(JobStatus.UNCLAIMED));
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  private void awaitCompleted(int expected, long timeoutMs) throws InterruptedException {
    JobAdmin admin = new JobAdmin(connectionProvider, jobStore);
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (System.currentTimeMillis() < deadline) {
      if (admin.count(JobStatus.COMPLETED) == expected) {
        return;
      }
      Thread.sleep(20);
    }
    fail("Expected " + expected + " completed jobs, got " + admin.count(JobStatus.COMPLETED));
  }
}
