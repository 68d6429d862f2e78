package jobflow.connector;

/**
 * Outcome state of a connector delivery.
 */
public enum DeliveryStatus {
  PENDING,
  DELIVERED,
  FAILED,
  RETRYING
}
