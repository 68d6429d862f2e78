package jobflow.connector;

/**
 * Thrown when a connector is misconfigured or cannot be set up.
 *
 * <p>Failed deliveries are reported as a {@link DeliveryResult}, not as this exception.
 */
public class DeliveryException extends RuntimeException {

  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
