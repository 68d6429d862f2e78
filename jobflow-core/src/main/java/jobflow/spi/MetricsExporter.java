package jobflow.spi;

/**
 * Observability hook for exporting worker and delivery counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see jobflow.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of jobs enqueued (deduplicated requests are not counted).
     */
    void incrementEnqueued();

    /**
     * Increments the count of jobs claimed by a worker.
     */
    void incrementClaimed();

    /**
     * Increments the count of jobs that completed successfully.
     */
    void incrementCompleted();

    /**
     * Increments the count of failed attempts re-queued for retry.
     */
    void incrementRetried();

    /**
     * Increments the count of jobs moved to DEAD_LETTER.
     */
    void incrementDeadLettered();

    /**
     * Increments the count of jobs that failed terminally without retry
     * (no handler, missing subject).
     */
    void incrementFailed();

    /**
     * Increments the count of stale PROCESSING jobs returned to PENDING.
     */
    default void incrementStaleRecovered(int count) {
    }

    /**
     * Records the number of jobs currently executing on a worker.
     */
    void recordActiveJobs(int active);

    /**
     * Records handler execution time.
     *
     * @param durationMs elapsed milliseconds (always non-negative)
     */
    default void recordJobDurationMs(long durationMs) {
    }

    /**
     * Records the final outcome of a connector delivery.
     *
     * @param connectorType connector type, e.g. {@code webhook}
     * @param success       whether the delivery succeeded
     */
    default void recordDelivery(String connectorType, boolean success) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementClaimed() {
        }

        @Override
        public void incrementCompleted() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementDeadLettered() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void recordActiveJobs(int active) {
        }
    }
}
