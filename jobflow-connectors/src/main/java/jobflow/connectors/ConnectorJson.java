package jobflow.connectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jobflow.connector.DeliveryException;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared Jackson setup for connector payloads.
 *
 * <p>Map keys are written in sorted order so that the same payload always produces
 * the same bytes, which HMAC signing relies on. {@code java.time} values are written
 * as ISO-8601 strings.
 */
public final class ConnectorJson {
  private static final Logger logger = Logger.getLogger(ConnectorJson.class.getName());
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .addModule(new JavaTimeModule())
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .build();
  private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

  private ConnectorJson() {}

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DeliveryException("Failed to serialize payload", e);
    }
  }

  public static String toPrettyJson(Object value) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DeliveryException("Failed to serialize payload", e);
    }
  }

  /**
   * Parses a JSON object.
   *
   * @return the object's entries, or {@code null} if the text is not a JSON object
   */
  public static Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(json, OBJECT_TYPE);
    } catch (JsonProcessingException e) {
      logger.log(Level.FINE, "Response body is not a JSON object: {0}", e.getOriginalMessage());
      return null;
    }
  }
}
