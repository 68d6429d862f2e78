package jobflow.worker;

/**
 * Retry policy using exponential backoff without jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^retryCount}, capped at {@code maxDelay}.
 * With a 5 s base and 300 s cap the delays run 5, 10, 20, 40, ... 300 s.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay after the first failure (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int retryCount) {
    if (retryCount < 0 || baseDelayMs == 0) {
      return baseDelayMs;
    }
    if (retryCount >= 62 || baseDelayMs > (maxDelayMs >> retryCount)) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs << retryCount);
  }
}
