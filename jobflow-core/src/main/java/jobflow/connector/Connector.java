package jobflow.connector;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends processed data to an external destination.
 *
 * @see AbstractConnector
 */
public interface Connector {

  /**
   * Short lower-case type name, e.g. {@code webhook}. Deliveries are tracked as
   * operation type {@code DELIVERY_<TYPE>}.
   */
  String connectorType();

  /**
   * Makes one delivery attempt.
   *
   * <p>Implementations report failures as an unsuccessful result. A runtime exception
   * is treated the same way by {@link AbstractConnector#deliverWithRetry}.
   */
  DeliveryResult deliver(DeliveryRequest request);

  /**
   * Delivers several requests. The default delivers them one by one.
   *
   * @return one result per request, in request order
   */
  default List<DeliveryResult> deliverBatch(List<DeliveryRequest> requests) {
    List<DeliveryResult> results = new ArrayList<>(requests.size());
    for (DeliveryRequest request : requests) {
      results.add(deliver(request));
    }
    return results;
  }
}
