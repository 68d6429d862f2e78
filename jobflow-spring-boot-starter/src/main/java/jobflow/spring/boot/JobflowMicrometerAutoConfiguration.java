package jobflow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import jobflow.micrometer.MicrometerMetricsExporter;
import jobflow.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code jobflow.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link JobflowAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the queue, worker and delivery tracker.
 */
@AutoConfiguration(before = JobflowAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "jobflow.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(JobflowProperties.class)
public class JobflowMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, JobflowProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
