package jobqueue.spring.boot;

import jobqueue.JobSubmitter;
import jobqueue.JobWorker;
import jobqueue.ProcessingPipeline;
import jobqueue.admin.JobAdmin;
import jobqueue.jdbc.DataSourceConnectionProvider;
import jobqueue.jdbc.TableNames;
import jobqueue.jdbc.purge.JdbcJobPurgers;
import jobqueue.jdbc.queue.PgmqQueueGateway;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.JdbcJobStores;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.MetricsExporter;
import jobqueue.spi.QueueGateway;
import jobqueue.worker.WorkerConfig;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the job worker.
 *
 * <p>Wires the job store, a pgmq queue gateway, a {@link JobSubmitter} and a
 * {@link JobAdmin} from a {@link DataSource}. A {@link JobWorker} is created and
 * started when the application defines a {@link ProcessingPipeline} bean.
 *
 * @see JobQueueProperties
 * @see JobQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobWorker.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcJobStore jobStore(DataSource dataSource, JobQueueProperties props) {
    AbstractJdbcJobStore detected = JdbcJobStores.detect(dataSource);
    String tableName = props.getTableName();
    if (!TableNames.DEFAULT_TABLE.equals(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(QueueGateway.class)
  public PgmqQueueGateway queueGateway(ConnectionProvider connectionProvider, JobQueueProperties props) {
    PgmqQueueGateway gateway = new PgmqQueueGateway(connectionProvider, props.getQueue().getName());
    if (props.getQueue().isCreateOnStartup()) {
      gateway.createQueue();
    }
    return gateway;
  }

  @Bean
  @ConditionalOnMissingBean
  public JobSubmitter jobSubmitter(ConnectionProvider connectionProvider, AbstractJdbcJobStore jobStore,
      QueueGateway queueGateway) {
    return new JobSubmitter(connectionProvider, jobStore, queueGateway);
  }

  @Bean
  @ConditionalOnMissingBean
  public JobAdmin jobAdmin(ConnectionProvider connectionProvider, AbstractJdbcJobStore jobStore) {
    return new JobAdmin(connectionProvider, jobStore);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(ProcessingPipeline.class)
  @ConditionalOnProperty(prefix = "jobqueue.worker", name = "enabled", matchIfMissing = true)
  public JobWorker jobWorker(JobQueueProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore,
      QueueGateway queueGateway,
      ProcessingPipeline pipeline,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = JobWorker.builder()
        .connectionProvider(connectionProvider)
        .queueGateway(queueGateway)
        .jobStore(jobStore)
        .pipeline(pipeline)
        .config(workerConfig(props.getWorker()));
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    if (props.getReclaim().isEnabled()) {
      builder.reclaimInterval(props.getReclaim().getInterval())
          .reclaimSkipRecent(props.getReclaim().getSkipRecent());
    }
    if (props.getPurge().isEnabled()) {
      builder.purger(JdbcJobPurgers.forStore(jobStore.name(), props.getTableName()))
          .purgeRetention(props.getPurge().getRetention())
          .purgeInterval(props.getPurge().getInterval())
          .purgeBatchSize(props.getPurge().getBatchSize());
    }
    return builder.build();
  }

  static WorkerConfig workerConfig(JobQueueProperties.Worker worker) {
    var builder = WorkerConfig.builder()
        .batchSize(worker.getBatchSize())
        .visibility(worker.getVisibility())
        .maxRetries(worker.getMaxRetries())
        .idleSleep(worker.getIdleSleep())
        .maxIdleSleep(worker.getMaxIdleSleep())
        .stalenessThreshold(worker.getStalenessThreshold())
        .pollInterval(worker.getPollInterval())
        .startupDelay(worker.getStartupDelay())
        .concurrency(worker.getConcurrency())
        .shutdownTimeout(worker.getShutdownTimeout());
    if (worker.getOwnerId() != null && !worker.getOwnerId().isEmpty()) {
      builder.ownerId(worker.getOwnerId());
    }
    return builder.build();
  }
}
