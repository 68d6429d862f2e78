package jobflow.worker;

import jobflow.StringOperationType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHandlerRegistryTest {

  @Test
  void looksUpByOperationType() {
    JobHandler<String> extract = (job, subject) -> "e";
    DefaultHandlerRegistry<String> registry = new DefaultHandlerRegistry<String>()
        .register(StringOperationType.of("EXTRACT"), extract);

    assertSame(extract, registry.handlerFor("EXTRACT").orElseThrow());
    assertTrue(registry.handlerFor("VALIDATE").isEmpty());
    assertEquals(Set.of("EXTRACT"), registry.operationTypes());
  }

  @Test
  void laterRegistrationReplacesEarlier() {
    JobHandler<String> second = (job, subject) -> "2";
    DefaultHandlerRegistry<String> registry = new DefaultHandlerRegistry<String>()
        .register("EXTRACT", (job, subject) -> "1")
        .register("EXTRACT", second);

    assertSame(second, registry.handlerFor("EXTRACT").orElseThrow());
    assertEquals(1, registry.operationTypes().size());
  }

  @Test
  void unregisterRemovesHandler() {
    DefaultHandlerRegistry<String> registry = new DefaultHandlerRegistry<String>()
        .register("EXTRACT", (job, subject) -> "1");

    assertTrue(registry.unregister("EXTRACT"));
    assertFalse(registry.unregister("EXTRACT"));
    assertTrue(registry.operationTypes().isEmpty());
  }

  @Test
  void rejectsNulls() {
    DefaultHandlerRegistry<String> registry = new DefaultHandlerRegistry<>();

    assertThrows(NullPointerException.class, () -> registry.register("EXTRACT", null));
    assertThrows(NullPointerException.class, () -> registry.register((String) null, (job, s) -> "x"));
  }
}
