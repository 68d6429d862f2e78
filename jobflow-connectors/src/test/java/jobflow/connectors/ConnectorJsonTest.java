package jobflow.connectors;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ConnectorJsonTest {

  @Test
  void writesKeysSorted() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("b", 1);
    payload.put("a", List.of("x"));
    assertEquals("{\"a\":[\"x\"],\"b\":1}", ConnectorJson.toJson(payload));
  }

  @Test
  void writesInstantsAsIsoStrings() {
    assertEquals("{\"at\":\"2024-03-01T10:00:00Z\"}",
        ConnectorJson.toJson(Map.of("at", Instant.parse("2024-03-01T10:00:00Z"))));
  }

  @Test
  void parseObjectReturnsNullForNonObjects() {
    assertNull(ConnectorJson.parseObject(""));
    assertNull(ConnectorJson.parseObject("plain text"));
    assertNull(ConnectorJson.parseObject("[1,2]"));
    assertEquals(Map.of("ok", true), ConnectorJson.parseObject("{\"ok\":true}"));
  }
}
