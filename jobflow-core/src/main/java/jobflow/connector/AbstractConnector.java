package jobflow.connector;

import jobflow.util.Sleeper;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class adding deduplication, retry with exponential backoff and delivery
 * tracking around {@link #deliver}.
 *
 * <p>Subclasses implement {@link #connectorType()} and {@link #deliver}.
 */
public abstract class AbstractConnector implements Connector {
  private static final Logger logger = Logger.getLogger(AbstractConnector.class.getName());

  protected final ConnectorConfig config;
  private final DeliveryTracker tracker;
  private final Sleeper sleeper;

  /**
   * @param config  shared connector settings
   * @param tracker delivery tracker, or {@code null} to skip deduplication and recording
   */
  protected AbstractConnector(ConnectorConfig config, DeliveryTracker tracker) {
    this(config, tracker, Sleeper.SYSTEM);
  }

  protected AbstractConnector(ConnectorConfig config, DeliveryTracker tracker, Sleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config");
    this.tracker = tracker;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public ConnectorConfig config() {
    return config;
  }

  /**
   * Returns {@code false} when deduplication is on and the subject was already
   * delivered by this connector type.
   */
  public boolean shouldDeliver(String subjectId) {
    if (!config.deduplication() || tracker == null) {
      return true;
    }
    return !tracker.checkDelivered(subjectId, connectorType());
  }

  /**
   * Delivers with deduplication and retries.
   *
   * <p>An already delivered subject yields a {@link DeliveryResult#skipped() skipped}
   * result without any call to the destination. Otherwise up to {@code maxRetries + 1}
   * attempts are made, waiting {@code retryDelay * 2^attempt} after each failed one.
   * The final outcome is recorded with the tracker.
   */
  public DeliveryResult deliverWithRetry(String subjectId, Map<String, Object> data, Map<String, Object> metadata) {
    if (!shouldDeliver(subjectId)) {
      logger.log(Level.FINE, "Subject {0} already delivered by {1}, skipping",
          new Object[]{subjectId, connectorType()});
      return DeliveryResult.skipped();
    }
    DeliveryRequest request = new DeliveryRequest(subjectId, data, metadata);
    DeliveryResult last = null;
    int attempt = 0;
    while (true) {
      last = attempt(request).withRetryCount(attempt);
      if (last.success()) {
        break;
      }
      if (attempt >= config.maxRetries()) {
        logger.log(Level.WARNING, "{0} delivery for subject {1} failed after {2} attempts: {3}",
            new Object[]{connectorType(), subjectId, attempt + 1, last.error()});
        break;
      }
      long delayMs = config.retryDelay().toMillis() << Math.min(attempt, 30);
      logger.log(Level.INFO, "{0} delivery for subject {1} failed ({2}), retrying in {3} ms",
          new Object[]{connectorType(), subjectId, last.error(), delayMs});
      try {
        sleeper.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      attempt++;
    }
    if (!last.success()) {
      last = last.withStatus(DeliveryStatus.FAILED);
    }
    recordOutcome(subjectId, last);
    return last;
  }

  /**
   * Records a final delivery outcome with the tracker, if there is one. Batch
   * implementations call this for every item they actually sent.
   */
  protected void recordOutcome(String subjectId, DeliveryResult result) {
    if (tracker != null) {
      tracker.recordDelivery(subjectId, connectorType(), result);
    }
  }

  private DeliveryResult attempt(DeliveryRequest request) {
    long start = System.nanoTime();
    try {
      DeliveryResult result = deliver(request);
      if (result == null) {
        return DeliveryResult.failed("Connector returned no result", null, elapsedMs(start));
      }
      return result;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, connectorType() + " delivery attempt threw", e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      return DeliveryResult.failed(message, null, elapsedMs(start));
    }
  }

  protected static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }
}
