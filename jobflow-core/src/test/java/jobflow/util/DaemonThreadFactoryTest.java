package jobflow.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

  @Test
  void createsNumberedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("jobflow-test-");

    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });

    assertEquals("jobflow-test-1", first.getName());
    assertEquals("jobflow-test-2", second.getName());
    assertTrue(first.isDaemon());
  }

  @Test
  void rejectsNullPrefix() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
