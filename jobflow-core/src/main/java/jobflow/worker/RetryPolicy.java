package jobflow.worker;

/**
 * Strategy for computing the delay before a failed job becomes eligible again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param retryCount number of attempts already re-queued for this job (0 for the first failure)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retryCount);
}
