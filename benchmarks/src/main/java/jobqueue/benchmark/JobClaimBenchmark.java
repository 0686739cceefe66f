package jobqueue.benchmark;

import jobqueue.JobOutcome;
import jobqueue.TranscriptionPayload;
import jobqueue.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.model.JobClaim;
import org.openjdk.jmh.annotations.*;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Measures the store's claim path: register, claim and finalize a fresh job per operation,
 * and contended claims where all threads race for a small set of jobs.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar JobClaimBenchmark}
 * <p>PostgreSQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=postgresql JobClaimBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class JobClaimBenchmark {
  private static final Duration THRESHOLD = Duration.ofMinutes(35);
  private static final int CONTENDED_JOBS = 16;

  private DataSource dataSource;
  private AbstractJdbcJobStore store;
  private final AtomicLong sequence = new AtomicLong();

  @Param({"h2"})
  private String database;

  @Setup(Level.Trial)
  public void setup() throws Exception {
    DatabaseSetup db = BenchmarkDataSourceFactory.create(database, "bench_claim");
    BenchmarkDataSourceFactory.truncate(db.dataSource());
    dataSource = db.dataSource();
    store = db.store();
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      for (int i = 0; i < CONTENDED_JOBS; i++) {
        store.registerIfAbsent(conn, TranscriptionPayload.of("hot-" + i), Instant.now());
      }
    }
  }

  @Benchmark
  public boolean claimAndComplete() throws Exception {
    TranscriptionPayload payload = TranscriptionPayload.of("doc-" + sequence.incrementAndGet());
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      Instant now = Instant.now();
      store.registerIfAbsent(conn, payload, now);
      Optional<JobClaim> claim = store.claim(conn, payload.jobId(), "bench", now, THRESHOLD);
      return claim.isPresent() && store.finalize(conn, claim.get(), JobOutcome.completed(null), now);
    }
  }

  /** Every claim on a hot job is yielded right away, so the race never ends. */
  @Benchmark
  @Threads(4)
  public boolean contendedClaim() throws Exception {
    String jobId = "transcription:hot-" + (sequence.incrementAndGet() % CONTENDED_JOBS);
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      Instant now = Instant.now();
      Optional<JobClaim> claim = store.claim(conn, jobId, Thread.currentThread().getName(), now, THRESHOLD);
      return claim.isPresent() && store.yieldClaim(conn, claim.get(), null, now);
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    if (dataSource instanceof AutoCloseable ac) ac.close();
  }
}
