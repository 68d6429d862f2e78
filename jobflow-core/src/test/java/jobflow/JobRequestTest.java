package jobflow;

import jobflow.model.JobPriority;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRequestTest {

  @Test
  void defaults() {
    JobRequest request = JobRequest.builder("doc_1", "EXTRACT").build();

    assertEquals(JobPriority.NORMAL, request.priority());
    assertTrue(request.dependsOn().isEmpty());
    assertTrue(request.details().isEmpty());
    assertNull(request.idempotencyKey());
  }

  @Test
  void generatesDistinctIds() {
    assertNotEquals(
        JobRequest.builder("doc_1", "EXTRACT").build().jobId(),
        JobRequest.builder("doc_1", "EXTRACT").build().jobId());
  }

  @Test
  void acceptsOperationTypeObjects() {
    JobRequest request = JobRequest.builder("doc_1", StringOperationType.of("VALIDATE")).build();

    assertEquals("VALIDATE", request.operationType());
  }

  @Test
  void rejectsMissingFields() {
    assertThrows(NullPointerException.class, () -> JobRequest.builder(null, "EXTRACT").build());
    assertThrows(NullPointerException.class, () -> JobRequest.builder("doc_1", (String) null).build());
    assertThrows(IllegalArgumentException.class, () -> JobRequest.builder("doc_1", "").build());
  }

  @Test
  void rejectsOverlongIdempotencyKey() {
    String key = "k".repeat(JobRequest.MAX_IDEMPOTENCY_KEY_LENGTH + 1);

    assertThrows(IllegalArgumentException.class,
        () -> JobRequest.builder("doc_1", "EXTRACT").idempotencyKey(key).build());
  }

  @Test
  void rejectsNullDetailValues() {
    Map<String, String> details = new HashMap<>();
    details.put("a", null);

    assertThrows(IllegalArgumentException.class,
        () -> JobRequest.builder("doc_1", "EXTRACT").details(details).build());
  }

  @Test
  void detailsAreCopied() {
    Map<String, String> details = new HashMap<>();
    details.put("a", "1");
    JobRequest request = JobRequest.builder("doc_1", "EXTRACT").details(details).build();
    details.put("b", "2");

    assertEquals(Map.of("a", "1"), request.details());
  }

  @Test
  void stringOperationTypeEquality() {
    assertEquals(StringOperationType.of("A"), StringOperationType.of("A"));
    assertEquals("A", StringOperationType.of("A").toString());
    assertThrows(IllegalArgumentException.class, () -> StringOperationType.of(""));
  }
}
