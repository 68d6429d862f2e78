package jobflow.spring.boot;

import jobflow.JobQueue;
import jobflow.connector.DeliveryTracker;
import jobflow.jdbc.DataSourceConnectionProvider;
import jobflow.jdbc.SchemaScripts;
import jobflow.jdbc.TableNames;
import jobflow.jdbc.store.AbstractJdbcJobStore;
import jobflow.jdbc.store.JdbcJobStores;
import jobflow.purge.CompletedJobPurgeScheduler;
import jobflow.ratelimit.CostTracker;
import jobflow.ratelimit.RateLimitConfig;
import jobflow.ratelimit.RateLimiter;
import jobflow.spi.ConnectionProvider;
import jobflow.spi.MetricsExporter;
import jobflow.worker.DefaultHandlerRegistry;
import jobflow.worker.SubjectResolver;
import jobflow.worker.Worker;

import org.springframework.beans.factory.ListableBeanFactory;
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
import java.time.Clock;

/**
 * Auto-configuration for the job pipeline.
 *
 * <p>Wires a {@link JobQueue}, {@link DeliveryTracker} and polling {@link Worker} from a
 * {@link DataSource} and {@link JobflowProperties}. Handlers are Spring beans annotated
 * with {@link JobHandlerFor}. Subjects are resolved by the application's
 * {@link SubjectResolver} bean, or passed through as IDs when there is none.
 *
 * @see JobflowProperties
 * @see JobflowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(JobflowProperties.class)
public class JobflowAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcJobStore jobStore(DataSource dataSource, JobflowProperties props) {
    String tableName = TableNames.validate(props.getTableName());
    AbstractJdbcJobStore store = props.getStore() != null && !props.getStore().isEmpty()
        ? JdbcJobStores.get(props.getStore())
        : JdbcJobStores.detect(dataSource);
    if (props.isInitializeSchema()) {
      if (!TableNames.DEFAULT_TABLE.equals(tableName)) {
        throw new IllegalStateException(
            "jobflow.initialize-schema only supports the default table name " + TableNames.DEFAULT_TABLE);
      }
      SchemaScripts.apply(dataSource, store.name());
    }
    return TableNames.DEFAULT_TABLE.equals(tableName) ? store : store.withTableName(tableName);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public JobQueue jobQueue(ConnectionProvider connectionProvider, AbstractJdbcJobStore jobStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return new JobQueue(connectionProvider, jobStore, metricsProvider.getIfAvailable(), Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public DeliveryTracker deliveryTracker(ConnectionProvider connectionProvider, AbstractJdbcJobStore jobStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return new DeliveryTracker(connectionProvider, jobStore,
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP), Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry<Object> handlerRegistry() {
    return new DefaultHandlerRegistry<>();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobHandlerRegistrar jobHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultHandlerRegistry<Object> handlerRegistry) {
    return new JobHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "jobflow.rate-limit", name = "enabled", havingValue = "true")
  public RateLimiter rateLimiter(JobflowProperties props) {
    var rl = props.getRateLimit();
    return new RateLimiter(RateLimitConfig.builder()
        .requestsPerMinute(rl.getRequestsPerMinute())
        .requestsPerHour(rl.getRequestsPerHour())
        .requestsPerDay(rl.getRequestsPerDay())
        .tokensPerMinute(rl.getTokensPerMinute())
        .tokensPerDay(rl.getTokensPerDay())
        .costPerDay(rl.getCostPerDay())
        .burstSize(rl.getBurstSize())
        .burstCooldown(rl.getBurstCooldown())
        .build());
  }

  @Bean
  @ConditionalOnMissingBean
  public CostTracker costTracker() {
    return new CostTracker();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "jobflow.worker", name = "enabled", matchIfMissing = true)
  @SuppressWarnings("unchecked")
  public Worker<Object> worker(JobflowProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore,
      DefaultHandlerRegistry<Object> handlerRegistry,
      ObjectProvider<SubjectResolver<?>> subjectResolverProvider,
      ObjectProvider<RateLimiter> rateLimiterProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    SubjectResolver<Object> resolver =
        (SubjectResolver<Object>) subjectResolverProvider.getIfAvailable(SubjectResolver::ids);
    var w = props.getWorker();
    return Worker.builder(resolver)
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .handlerRegistry(handlerRegistry)
        .rateLimiter(rateLimiterProvider.getIfAvailable())
        .metrics(metricsProvider.getIfAvailable())
        .pollInterval(w.getPollInterval())
        .batchSize(w.getBatchSize())
        .maxConcurrent(w.getMaxConcurrent())
        .maxRetries(w.getMaxRetries())
        .retryDelayBase(w.getRetryDelayBase())
        .retryDelayMax(w.getRetryDelayMax())
        .jobTimeout(w.getJobTimeout())
        .staleJobTimeout(w.getStaleJobTimeout())
        .shutdownTimeout(w.getShutdownTimeout())
        .operationTypes(w.getOperationTypes())
        .build();
  }

  @Bean
  @ConditionalOnBean(Worker.class)
  @ConditionalOnMissingBean
  public WorkerLifecycle workerLifecycle(Worker<?> worker) {
    return new WorkerLifecycle(worker);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "jobflow.purge", name = "enabled", havingValue = "true")
  public CompletedJobPurgeScheduler completedJobPurgeScheduler(JobflowProperties props,
      ConnectionProvider connectionProvider, AbstractJdbcJobStore jobStore) {
    var purge = props.getPurge();
    return CompletedJobPurgeScheduler.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .retention(purge.getRetention())
        .batchSize(purge.getBatchSize())
        .interval(purge.getInterval())
        .build();
  }
}
