package jobflow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the job pipeline.
 *
 * @see JobflowAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobflow")
public class JobflowProperties {

    /**
     * Database table name for jobs. The dependency table is named {@code <table>_dependency}.
     */
    private String tableName = "jobflow_job";

    /**
     * Job store name ({@code h2}, {@code mysql}, {@code postgresql}). Detected from the
     * DataSource URL when unset.
     */
    private String store;

    /**
     * Create the job tables on startup if they do not exist. Only the default table name is supported.
     */
    private boolean initializeSchema = false;

    private final Worker worker = new Worker();
    private final RateLimit rateLimit = new RateLimit();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Worker getWorker() {
        return worker;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 10;
        private int maxConcurrent = 5;
        private int maxRetries = 3;
        private Duration retryDelayBase = Duration.ofSeconds(5);
        private Duration retryDelayMax = Duration.ofSeconds(300);
        private Duration jobTimeout = Duration.ofSeconds(300);
        /**
         * Age after which a PROCESSING claim is recovered. Must exceed the job timeout; zero disables recovery.
         */
        private Duration staleJobTimeout = Duration.ofSeconds(600);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        /**
         * Operation types to poll. Empty means every type with a registered handler.
         */
        private List<String> operationTypes = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelayBase() {
            return retryDelayBase;
        }

        public void setRetryDelayBase(Duration retryDelayBase) {
            this.retryDelayBase = retryDelayBase;
        }

        public Duration getRetryDelayMax() {
            return retryDelayMax;
        }

        public void setRetryDelayMax(Duration retryDelayMax) {
            this.retryDelayMax = retryDelayMax;
        }

        public Duration getJobTimeout() {
            return jobTimeout;
        }

        public void setJobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
        }

        public Duration getStaleJobTimeout() {
            return staleJobTimeout;
        }

        public void setStaleJobTimeout(Duration staleJobTimeout) {
            this.staleJobTimeout = staleJobTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public List<String> getOperationTypes() {
            return operationTypes;
        }

        public void setOperationTypes(List<String> operationTypes) {
            this.operationTypes = operationTypes;
        }
    }

    public static class RateLimit {
        private boolean enabled = false;
        private int requestsPerMinute = 60;
        private int requestsPerHour = 1000;
        private int requestsPerDay = 10_000;
        private Long tokensPerMinute;
        private Long tokensPerDay;
        private Double costPerDay;
        private int burstSize = 10;
        private Duration burstCooldown = Duration.ofSeconds(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public int getRequestsPerHour() {
            return requestsPerHour;
        }

        public void setRequestsPerHour(int requestsPerHour) {
            this.requestsPerHour = requestsPerHour;
        }

        public int getRequestsPerDay() {
            return requestsPerDay;
        }

        public void setRequestsPerDay(int requestsPerDay) {
            this.requestsPerDay = requestsPerDay;
        }

        public Long getTokensPerMinute() {
            return tokensPerMinute;
        }

        public void setTokensPerMinute(Long tokensPerMinute) {
            this.tokensPerMinute = tokensPerMinute;
        }

        public Long getTokensPerDay() {
            return tokensPerDay;
        }

        public void setTokensPerDay(Long tokensPerDay) {
            this.tokensPerDay = tokensPerDay;
        }

        public Double getCostPerDay() {
            return costPerDay;
        }

        public void setCostPerDay(Double costPerDay) {
            this.costPerDay = costPerDay;
        }

        public int getBurstSize() {
            return burstSize;
        }

        public void setBurstSize(int burstSize) {
            this.burstSize = burstSize;
        }

        public Duration getBurstCooldown() {
            return burstCooldown;
        }

        public void setBurstCooldown(Duration burstCooldown) {
            this.burstCooldown = burstCooldown;
        }
    }

    public static class Purge {
        private boolean enabled = false;
        private Duration retention = Duration.ofDays(30);
        private int batchSize = 500;
        private Duration interval = Duration.ofHours(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobflow";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
