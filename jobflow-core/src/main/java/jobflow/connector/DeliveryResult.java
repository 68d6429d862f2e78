package jobflow.connector;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of a delivery attempt, or of a whole {@link AbstractConnector#deliverWithRetry} run.
 *
 * @param deliveryId   {@code dlv_} followed by 12 hex characters
 * @param success      whether the data reached the destination
 * @param status       delivery status
 * @param responseData connector-specific response details (never {@code null})
 * @param responseCode protocol response code where there is one, e.g. HTTP status
 * @param deliveredAt  time of the attempt
 * @param durationMs   time spent on the attempt
 * @param error        failure message, {@code null} on success
 * @param retryCount   attempts made before this one
 */
public record DeliveryResult(
    String deliveryId,
    boolean success,
    DeliveryStatus status,
    Map<String, Object> responseData,
    Integer responseCode,
    Instant deliveredAt,
    long durationMs,
    String error,
    int retryCount) {

  public static final String SKIPPED_KEY = "skipped";
  public static final String ALREADY_DELIVERED = "already_delivered";

  public DeliveryResult {
    responseData = responseData == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(responseData));
  }

  public static String newDeliveryId() {
    return "dlv_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }

  public static DeliveryResult delivered(Map<String, Object> responseData, Integer responseCode, long durationMs) {
    return new DeliveryResult(newDeliveryId(), true, DeliveryStatus.DELIVERED, responseData, responseCode,
        Instant.now(), durationMs, null, 0);
  }

  public static DeliveryResult failed(String error, Integer responseCode, long durationMs) {
    return new DeliveryResult(newDeliveryId(), false, DeliveryStatus.FAILED, Map.of(), responseCode,
        Instant.now(), durationMs, error, 0);
  }

  /**
   * Successful result for a subject that was delivered before and not sent again.
   */
  public static DeliveryResult skipped() {
    return new DeliveryResult(newDeliveryId(), true, DeliveryStatus.DELIVERED,
        Map.of(SKIPPED_KEY, ALREADY_DELIVERED), null, Instant.now(), 0L, null, 0);
  }

  public boolean isSkipped() {
    return ALREADY_DELIVERED.equals(responseData.get(SKIPPED_KEY));
  }

  public DeliveryResult withRetryCount(int retryCount) {
    return new DeliveryResult(deliveryId, success, status, responseData, responseCode,
        deliveredAt, durationMs, error, retryCount);
  }

  public DeliveryResult withStatus(DeliveryStatus status) {
    return new DeliveryResult(deliveryId, success, status, responseData, responseCode,
        deliveredAt, durationMs, error, retryCount);
  }
}
