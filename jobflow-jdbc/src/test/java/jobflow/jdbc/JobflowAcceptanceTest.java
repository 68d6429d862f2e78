package jobflow.jdbc;

import jobflow.JobQueue;
import jobflow.JobRequest;
import jobflow.connector.AbstractConnector;
import jobflow.connector.ConnectorConfig;
import jobflow.connector.DeliveryRequest;
import jobflow.connector.DeliveryResult;
import jobflow.connector.DeliveryTracker;
import jobflow.jdbc.store.H2JobStore;
import jobflow.model.Job;
import jobflow.model.JobStatus;
import jobflow.purge.CompletedJobPurgeScheduler;
import jobflow.worker.DefaultHandlerRegistry;
import jobflow.worker.SubjectResolver;
import jobflow.worker.Worker;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end flows through the queue, worker, delivery tracking and purge on H2.
 */
class JobflowAcceptanceTest {
  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private H2JobStore jobStore;
  private JobQueue queue;
  private DefaultHandlerRegistry<String> registry;
  private Worker<String> worker;

  @BeforeEach
  void setUp() {
    dataSource = H2JobStoreTest.h2WithSchema();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    jobStore = new H2JobStore();
    queue = new JobQueue(connectionProvider, jobStore);
    registry = new DefaultHandlerRegistry<>();
  }

  @AfterEach
  void tearDown() {
    if (worker != null) {
      worker.close();
    }
  }

  private Worker<String> newWorker(int maxRetries) {
    return Worker.builder(SubjectResolver.ids())
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .handlerRegistry(registry)
        .maxRetries(maxRetries)
        .retryPolicy(retryCount -> 0L)
        .shutdownTimeout(Duration.ofSeconds(5))
        .build();
  }

  private Job awaitStatus(String jobId, JobStatus expected) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5_000;
    Job job = null;
    while (System.currentTimeMillis() < deadline) {
      worker.poll();
      job = queue.getJob(jobId).orElseThrow();
      if (job.status() == expected) {
        return job;
      }
      Thread.sleep(20);
    }
    throw new AssertionError("Job " + jobId + " did not reach " + expected + ", last: " + job);
  }

  // ── Pipeline ────────────────────────────────────────────────────

  @Test
  void dependentJobRunsAfterItsParent() throws Exception {
    List<String> order = new CopyOnWriteArrayList<>();
    registry.register("EXTRACT", (job, subject) -> {
      order.add("EXTRACT");
      return "text";
    });
    registry.register("CLASSIFY", (job, subject) -> {
      order.add("CLASSIFY");
      return "invoice";
    });
    worker = newWorker(3);

    String extract = queue.enqueue(JobRequest.builder("doc_1", "EXTRACT").build());
    String classify = queue.enqueue(JobRequest.builder("doc_1", "CLASSIFY").dependsOn(extract).build());

    Job done = awaitStatus(classify, JobStatus.COMPLETED);

    assertEquals("invoice", done.result());
    assertEquals(List.of("EXTRACT", "CLASSIFY"), order);
    assertEquals(List.of(extract), queue.getDependencies(classify));
  }

  @Test
  void exhaustedRetriesDeadLetterAndCanBeRequeued() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    registry.register("EXTRACT", (job, subject) -> {
      if (calls.incrementAndGet() <= 2) {
        throw new IllegalStateException("OCR engine unavailable");
      }
      return "ok";
    });
    worker = newWorker(1);

    String id = queue.enqueue(JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("extract-doc_1").build());
    Job dead = awaitStatus(id, JobStatus.DEAD_LETTER);

    assertEquals("Max retries exceeded. Last error: OCR engine unavailable", dead.error());
    assertEquals(1, dead.retryCount());
    assertEquals(List.of(id), queue.getDeadLetterJobs("EXTRACT", 10).stream().map(Job::id).toList());

    String replacement = queue.enqueue(JobRequest.builder("doc_1", "EXTRACT").idempotencyKey("extract-doc_1").build());
    assertFalse(replacement.equals(id), "dead-lettered job no longer holds its idempotency key");
    assertTrue(queue.cancel(replacement));

    assertTrue(queue.retryFailed(id, true));
    Job recovered = awaitStatus(id, JobStatus.COMPLETED);
    assertEquals("ok", recovered.result());
  }

  @Test
  void queueStatsReflectDatabaseState() {
    queue.enqueue(JobRequest.builder("doc_1", "EXTRACT").build());
    queue.enqueue(JobRequest.builder("doc_2", "EXTRACT").build());
    String cancelled = queue.enqueue(JobRequest.builder("doc_3", "CLASSIFY").build());
    queue.cancel(cancelled);

    assertEquals(3, queue.getQueueStats().total());
    assertEquals(2, queue.getQueueStats().count(JobStatus.PENDING));
    assertEquals(1, queue.getQueueStats().count(JobStatus.CANCELLED));
    assertEquals(2, queue.getPendingCount("EXTRACT"));
    assertEquals(0, queue.getPendingCount("CLASSIFY"));
  }

  // ── Delivery tracking ───────────────────────────────────────────

  @Test
  void trackedConnectorDeliversOnceAndKeepsHistory() {
    DeliveryTracker tracker = new DeliveryTracker(connectionProvider, jobStore);
    AtomicInteger sends = new AtomicInteger();
    AbstractConnector connector = new AbstractConnector(
        ConnectorConfig.builder().name("erp").maxRetries(1).build(), tracker, delayMs -> { }) {
      @Override
      public String connectorType() {
        return "webhook";
      }

      @Override
      public DeliveryResult deliver(DeliveryRequest request) {
        if (sends.incrementAndGet() == 1) {
          return DeliveryResult.failed("HTTP 503", 503, 3);
        }
        return DeliveryResult.delivered(Map.of("ack", "yes"), 200, 4);
      }
    };

    DeliveryResult first = connector.deliverWithRetry("doc_1", Map.of("total", 42), Map.of());
    DeliveryResult second = connector.deliverWithRetry("doc_1", Map.of("total", 42), Map.of());

    assertTrue(first.success());
    assertEquals(1, first.retryCount());
    assertTrue(second.isSkipped());
    assertEquals(2, sends.get());
    assertTrue(tracker.checkDelivered("doc_1", "webhook"));
    assertFalse(tracker.checkDelivered("doc_1", "s3"));

    List<Job> history = tracker.getDeliveryHistory("doc_1", 10);
    assertEquals(1, history.size());
    Job record = history.get(0);
    assertEquals("DELIVERY_WEBHOOK", record.operationType());
    assertEquals(JobStatus.COMPLETED, record.status());
    assertEquals(first.deliveryId(), record.details().get("delivery_id"));
    assertEquals("yes", record.details().get("response.ack"));
  }

  // ── Purge ───────────────────────────────────────────────────────

  @Test
  void purgeSchedulerRemovesOldCompletedJobs() throws Exception {
    registry.register("EXTRACT", (job, subject) -> "ok");
    worker = newWorker(0);
    String done = queue.enqueue(JobRequest.builder("doc_1", "EXTRACT").build());
    awaitStatus(done, JobStatus.COMPLETED);
    String pending = queue.enqueue(JobRequest.builder("doc_2", "CLASSIFY").build());

    Clock future = Clock.fixed(Instant.now().plus(31, ChronoUnit.DAYS), ZoneOffset.UTC);
    try (CompletedJobPurgeScheduler purger = CompletedJobPurgeScheduler.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .retention(Duration.ofDays(30))
        .clock(future)
        .build()) {
      assertEquals(1L, purger.runOnce());
    }

    assertTrue(queue.getJob(done).isEmpty());
    assertTrue(queue.getJob(pending).isPresent());
  }
}
