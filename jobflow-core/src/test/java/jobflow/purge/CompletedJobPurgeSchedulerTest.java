package jobflow.purge;

import jobflow.InMemoryJobStore;
import jobflow.JobRequest;
import jobflow.MutableClock;
import jobflow.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;

import static jobflow.TestConnections.dummyConnection;
import static jobflow.TestConnections.dummyProvider;
import static jobflow.TestConnections.failingProvider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompletedJobPurgeSchedulerTest {
  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

  private static void addCompleted(InMemoryJobStore store, String id, Instant completedAt) {
    Connection conn = dummyConnection();
    store.insert(conn, JobRequest.builder("doc", "EXTRACT").jobId(id).build());
    store.claim(conn, id, completedAt);
    store.markCompleted(conn, id, completedAt, "ok", completedAt);
  }

  @Test
  void purgesInBatchesUntilShortBatch() {
    InMemoryJobStore store = new InMemoryJobStore();
    for (int i = 0; i < 5; i++) {
      addCompleted(store, "old_" + i, NOW.minus(Duration.ofDays(40)));
    }
    addCompleted(store, "recent", NOW.minus(Duration.ofDays(1)));

    try (CompletedJobPurgeScheduler scheduler = CompletedJobPurgeScheduler.builder()
        .connectionProvider(dummyProvider())
        .jobStore(store)
        .retention(Duration.ofDays(30))
        .batchSize(2)
        .clock(new MutableClock(NOW))
        .build()) {

      assertEquals(5, scheduler.runOnce());
    }
    assertEquals(1, store.size());
    assertEquals(JobStatus.COMPLETED, store.findById(null, "recent").orElseThrow().status());
  }

  @Test
  void connectionFailureIsLoggedNotThrown() {
    try (CompletedJobPurgeScheduler scheduler = CompletedJobPurgeScheduler.builder()
        .connectionProvider(failingProvider())
        .jobStore(new InMemoryJobStore())
        .build()) {

      assertEquals(0, scheduler.runOnce());
    }
  }

  @Test
  void closedSchedulerDoesNothing() {
    InMemoryJobStore store = new InMemoryJobStore();
    addCompleted(store, "old", NOW.minus(Duration.ofDays(40)));
    CompletedJobPurgeScheduler scheduler = CompletedJobPurgeScheduler.builder()
        .connectionProvider(dummyProvider())
        .jobStore(store)
        .clock(new MutableClock(NOW))
        .build();

    scheduler.close();

    assertEquals(0, scheduler.runOnce());
    assertThrows(IllegalStateException.class, scheduler::start);
    assertTrue(store.findById(null, "old").isPresent());
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> CompletedJobPurgeScheduler.builder()
        .jobStore(new InMemoryJobStore()).build());
    assertThrows(IllegalArgumentException.class, () -> CompletedJobPurgeScheduler.builder()
        .connectionProvider(dummyProvider()).jobStore(new InMemoryJobStore()).batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> CompletedJobPurgeScheduler.builder()
        .connectionProvider(dummyProvider()).jobStore(new InMemoryJobStore())
        .retention(Duration.ofDays(-1)).build());
  }
}
