package jobflow;

import jobflow.model.Job;
import jobflow.model.JobPriority;
import jobflow.model.JobStatus;
import jobflow.model.QueueStats;
import jobflow.spi.ConnectionProvider;
import jobflow.spi.JobStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static jobflow.TestConnections.dummyConnection;
import static jobflow.TestConnections.dummyProvider;
import static jobflow.TestConnections.failingProvider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobQueueTest {
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private InMemoryJobStore store;
  private MutableClock clock;
  private JobQueue queue;

  @BeforeEach
  void setUp() {
    store = new InMemoryJobStore();
    clock = new MutableClock(NOW);
    queue = new JobQueue(dummyProvider(), store, null, clock);
  }

  @Test
  void enqueueCreatesPendingJob() {
    String id = queue.enqueue(JobRequest.builder("doc_1", "EXTRACT")
        .priority(JobPriority.HIGH)
        .tenantId("acme")
        .details(Map.of("source", "upload"))
        .build());

    Job job = queue.getJob(id).orElseThrow();
    assertTrue(id.startsWith("job_"));
    assertEquals(JobStatus.PENDING, job.status());
    assertEquals(JobPriority.HIGH, job.priority());
    assertEquals("acme", job.tenantId());
    assertEquals(0, job.retryCount());
    assertEquals("upload", job.details().get("source"));
  }

  @Test
  void idempotentEnqueueReturnsExistingIdWithoutNewRow() {
    JobRequest first = JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("k1").build();
    JobRequest second = JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("k1").build();

    String id1 = queue.enqueue(first);
    String id2 = queue.enqueue(second);

    assertEquals(id1, id2);
    assertEquals(1, queue.getQueueStats().total());
  }

  @Test
  void idempotencyKeyIsFreedByCancellation() {
    String id1 = queue.enqueue(JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("k1").build());
    assertTrue(queue.cancel(id1));

    String id2 = queue.enqueue(JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("k1").build());

    assertNotEquals(id1, id2);
    assertEquals(2, store.size());
  }

  @Test
  void enqueueBatchDedupsWithinBatch() {
    List<String> ids = queue.enqueueBatch(List.of(
        JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("a").build(),
        JobRequest.builder("doc_2", "EXTRACT").build(),
        JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("a").build()));

    assertEquals(3, ids.size());
    assertEquals(ids.get(0), ids.get(2));
    assertEquals(2, store.size());
  }

  @Test
  void enqueueStoresDependencies() {
    String parent = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));
    String child = queue.enqueue(JobRequest.builder("doc_1", "VALIDATE").dependsOn(parent).build());

    assertEquals(List.of(parent), queue.getDependencies(child));
  }

  @Test
  void enqueueFailureSurfacesAsJobStoreException() {
    JobQueue failing = new JobQueue(failingProvider(), store);

    assertThrows(JobStoreException.class,
        () -> failing.enqueue(JobRequest.builder("doc_1", "EXTRACT").build()));
  }

  @Test
  void cancelOnlyAffectsPendingJobs() {
    String id = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));
    store.claim(dummyConnection(), id, NOW);

    assertFalse(queue.cancel(id));
    assertFalse(queue.cancel("job_missing"));
    assertEquals(JobStatus.PROCESSING, queue.getJobStatus(id).orElseThrow());
  }

  @Test
  void cancelledJobGetsCompletionTime() {
    String id = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));

    assertTrue(queue.cancel(id));

    Job job = queue.getJob(id).orElseThrow();
    assertEquals(JobStatus.CANCELLED, job.status());
    assertEquals(NOW, job.completedAt());
  }

  @Test
  void retryFailedResetsDeadLetterJob() {
    String id = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));
    Connection conn = dummyConnection();
    store.claim(conn, id, NOW);
    store.markRetry(conn, id, NOW, NOW, "boom");
    store.claim(conn, id, NOW);
    store.markDeadLetter(conn, id, NOW, "Max retries exceeded. Last error: boom", NOW);

    assertTrue(queue.retryFailed(id, false));

    Job job = queue.getJob(id).orElseThrow();
    assertEquals(JobStatus.PENDING, job.status());
    assertEquals(1, job.retryCount());
    assertNull(job.error());
    assertNull(job.completedAt());
  }

  @Test
  void retryFailedCanResetRetryCount() {
    String id = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));
    Connection conn = dummyConnection();
    store.claim(conn, id, NOW);
    store.markRetry(conn, id, NOW, NOW, "boom");
    store.claim(conn, id, NOW);
    store.markFailed(conn, id, NOW, "gone", NOW);

    assertTrue(queue.retryFailed(id, true));
    assertEquals(0, queue.getJob(id).orElseThrow().retryCount());
  }

  @Test
  void retryFailedRejectsPendingJob() {
    String id = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));

    assertFalse(queue.retryFailed(id, false));
  }

  @Test
  void lifecycleOperationsReturnFalseWhenDatabaseUnavailable() {
    JobQueue failing = new JobQueue(failingProvider(), store);

    assertFalse(failing.cancel("job_1"));
    assertFalse(failing.retryFailed("job_1", true));
    assertTrue(failing.getJob("job_1").isEmpty());
    assertEquals(0, failing.getQueueStats().total());
  }

  @Test
  void queueStatsGroupByStatusAndType() {
    queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));
    queue.enqueue("doc_2", StringOperationType.of("EXTRACT"));
    String validate = queue.enqueue("doc_1", StringOperationType.of("VALIDATE"));
    queue.cancel(validate);

    QueueStats stats = queue.getQueueStats();

    assertEquals(3, stats.total());
    assertEquals(2, stats.count(JobStatus.PENDING));
    assertEquals(1, stats.count(JobStatus.CANCELLED));
    assertEquals(0, stats.count(JobStatus.FAILED));
    assertEquals(2, stats.byType().get("EXTRACT"));
    assertEquals(1, stats.byType().get("VALIDATE"));
    assertEquals(2, queue.getPendingCount(null));
    assertEquals(0, queue.getPendingCount("VALIDATE"));
  }

  @Test
  void deadLetterJobsNewestFirst() {
    Connection conn = dummyConnection();
    String older = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));
    String newer = queue.enqueue("doc_2", StringOperationType.of("EXTRACT"));
    store.claim(conn, older, NOW);
    store.markDeadLetter(conn, older, NOW, "x", NOW);
    store.claim(conn, newer, NOW);
    store.markDeadLetter(conn, newer, NOW, "y", NOW.plusSeconds(5));

    List<Job> dead = queue.getDeadLetterJobs(null, 10);

    assertEquals(List.of(newer, older), List.of(dead.get(0).id(), dead.get(1).id()));
  }

  @Test
  void clearCompletedDeletesOnlyOldCompletedJobs() {
    Connection conn = dummyConnection();
    String old = queue.enqueue("doc_1", StringOperationType.of("EXTRACT"));
    String recent = queue.enqueue("doc_2", StringOperationType.of("EXTRACT"));
    String failed = queue.enqueue("doc_3", StringOperationType.of("EXTRACT"));
    store.claim(conn, old, NOW);
    store.markCompleted(conn, old, NOW, "ok", NOW.minus(Duration.ofDays(40)));
    store.claim(conn, recent, NOW);
    store.markCompleted(conn, recent, NOW, "ok", NOW.minus(Duration.ofDays(2)));
    store.claim(conn, failed, NOW);
    store.markFailed(conn, failed, NOW, "bad", NOW.minus(Duration.ofDays(90)));

    assertEquals(1, queue.clearCompleted(30));

    assertTrue(queue.getJob(old).isEmpty());
    assertTrue(queue.getJob(recent).isPresent());
    assertTrue(queue.getJob(failed).isPresent());
  }

  @Test
  void clearCompletedRejectsNegativeAge() {
    assertThrows(IllegalArgumentException.class, () -> queue.clearCompleted(-1));
  }

  @Test
  void rollsBackWhenInsertFails() {
    int[] rollbacks = {0};
    ConnectionProvider tracking = () -> (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(), new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          if (method.getName().equals("rollback")) {
            rollbacks[0]++;
          }
          return null;
        });
    InMemoryJobStore broken = new InMemoryJobStore() {
      @Override
      public void insert(Connection conn, JobRequest request) {
        throw new JobStoreException("insert failed");
      }
    };
    JobQueue failing = new JobQueue(tracking, broken);

    assertThrows(JobStoreException.class, () -> failing.enqueue("doc_1", StringOperationType.of("EXTRACT")));
    assertEquals(1, rollbacks[0]);
  }
}
