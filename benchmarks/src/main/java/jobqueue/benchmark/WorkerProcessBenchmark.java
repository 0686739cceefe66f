package jobqueue.benchmark;

import jobqueue.JobOutcome;
import jobqueue.TranscriptionPayload;
import jobqueue.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import jobqueue.jdbc.DataSourceConnectionProvider;
import jobqueue.model.QueueMessage;
import jobqueue.spi.QueueGateway;
import jobqueue.util.JsonCodec;
import jobqueue.worker.MessageDisposition;
import jobqueue.worker.WorkerConfig;
import jobqueue.worker.WorkerLoop;
import org.openjdk.jmh.annotations.*;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Measures one full delivery through {@link WorkerLoop#process}: decode, register,
 * claim, a no-op pipeline, finalize and acknowledge.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar WorkerProcessBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class WorkerProcessBenchmark {

  private DataSource dataSource;
  private WorkerLoop loop;
  private final AtomicLong sequence = new AtomicLong();

  @Param({"h2"})
  private String database;

  @Setup(Level.Trial)
  public void setup() {
    DatabaseSetup db = BenchmarkDataSourceFactory.create(database, "bench_process");
    BenchmarkDataSourceFactory.truncate(db.dataSource());
    dataSource = db.dataSource();
    loop = WorkerLoop.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .queueGateway(new AckOnlyQueueGateway())
        .jobStore(db.store())
        .pipeline((payload, claim) -> JobOutcome.completed(null))
        .config(WorkerConfig.builder().ownerId("bench").build())
        .build();
  }

  @Benchmark
  public MessageDisposition processDelivery() {
    long id = sequence.incrementAndGet();
    String body = TranscriptionPayload.of("doc-" + id).toJson(JsonCodec.getDefault());
    Instant now = Instant.now();
    return loop.process(new QueueMessage(id, 1, body, now, now.plusSeconds(1800)));
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    loop.close();
    if (dataSource instanceof AutoCloseable ac) ac.close();
  }

  /** Deliveries are fed directly to the loop; only acknowledgements reach the queue. */
  private static final class AckOnlyQueueGateway implements QueueGateway {
    @Override
    public List<QueueMessage> dequeue(Duration visibility, int maxCount) {
      return List.of();
    }

    @Override
    public void ackDelete(long messageId) {
    }

    @Override
    public void ackArchive(long messageId) {
    }
  }
}
