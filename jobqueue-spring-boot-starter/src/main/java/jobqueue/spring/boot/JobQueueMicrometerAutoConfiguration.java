package jobqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import jobqueue.micrometer.MicrometerMetricsExporter;
import jobqueue.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code jobqueue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link JobQueueAutoConfiguration} so the exporter is available to
 * the {@link jobqueue.JobWorker}.
 */
@AutoConfiguration(before = JobQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "jobqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobQueueMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, JobQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
