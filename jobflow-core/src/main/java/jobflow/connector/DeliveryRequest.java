package jobflow.connector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Data to deliver for one subject.
 *
 * @param subjectId the subject, e.g. a document ID
 * @param data      the payload
 * @param metadata  extra attributes passed along with the payload (never {@code null})
 */
public record DeliveryRequest(String subjectId, Map<String, Object> data, Map<String, Object> metadata) {

  public DeliveryRequest {
    Objects.requireNonNull(subjectId, "subjectId");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static DeliveryRequest of(String subjectId, Map<String, Object> data) {
    return new DeliveryRequest(subjectId, data, Map.of());
  }
}
