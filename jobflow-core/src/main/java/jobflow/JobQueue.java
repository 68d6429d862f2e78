package jobflow;

import jobflow.model.Job;
import jobflow.model.JobStatus;
import jobflow.model.QueueStats;
import jobflow.spi.ConnectionProvider;
import jobflow.spi.JobStore;
import jobflow.spi.JobStoreException;
import jobflow.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Facade for enqueueing jobs and managing their lifecycle outside the worker.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 * Enqueue operations run in their own transaction and throw {@link JobStoreException}
 * on failure. Lifecycle operations ({@link #cancel}, {@link #retryFailed}) and queries
 * log database errors and report them as {@code false} or an empty result.
 *
 * <p>Idempotency keys are checked and inserted in the same transaction. Two processes
 * enqueueing the same key at the same instant can both insert; add a unique index on
 * live keys where that matters.
 *
 * @see jobflow.worker.Worker
 */
public final class JobQueue {
  private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

  static final int CLEAR_BATCH_SIZE = 1000;

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final MetricsExporter metrics;
  private final Clock clock;

  public JobQueue(ConnectionProvider connectionProvider, JobStore jobStore) {
    this(connectionProvider, jobStore, MetricsExporter.NOOP, Clock.systemUTC());
  }

  public JobQueue(ConnectionProvider connectionProvider, JobStore jobStore,
      MetricsExporter metrics, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Enqueues a job with default options.
   *
   * @return the new job ID
   */
  public String enqueue(String subjectId, OperationType operationType) {
    return enqueue(JobRequest.builder(subjectId, operationType).build());
  }

  /**
   * Enqueues a job.
   *
   * <p>If the request carries an idempotency key and a live job (any status other than
   * CANCELLED or DEAD_LETTER) already holds that key, nothing is written and the existing
   * job's ID is returned. Otherwise the job row and one dependency row per
   * {@code dependsOn} entry are inserted together.
   *
   * <p>A job with dependencies is not claimed until each of them is COMPLETED. One whose
   * dependency is cancelled or fails for good stays PENDING; {@link #retryFailed} on the
   * dependency or {@link #cancel} on this job are the ways out.
   *
   * @param request the job to enqueue
   * @return the new or existing job ID
   * @throws JobStoreException if the insert fails
   */
  public String enqueue(JobRequest request) {
    Objects.requireNonNull(request, "request");
    return inTransaction("enqueue job for subject " + request.subjectId(),
        conn -> enqueueInternal(conn, request, Map.of()));
  }

  /**
   * Enqueues several jobs in a single transaction.
   *
   * <p>Deduplication applies per job; a key repeated within the batch also resolves to
   * the first job carrying it.
   *
   * @return job IDs in request order
   * @throws JobStoreException if any insert fails, in which case none are written
   */
  public List<String> enqueueBatch(List<JobRequest> requests) {
    Objects.requireNonNull(requests, "requests");
    if (requests.isEmpty()) {
      return List.of();
    }
    return inTransaction("enqueue batch of " + requests.size() + " jobs", conn -> {
      Map<String, String> seenKeys = new HashMap<>();
      List<String> ids = new ArrayList<>(requests.size());
      for (JobRequest request : requests) {
        String id = enqueueInternal(conn, request, seenKeys);
        if (request.idempotencyKey() != null) {
          seenKeys.putIfAbsent(request.idempotencyKey(), id);
        }
        ids.add(id);
      }
      return ids;
    });
  }

  private String enqueueInternal(Connection conn, JobRequest request, Map<String, String> seenKeys) {
    String key = request.idempotencyKey();
    if (key != null) {
      String seen = seenKeys.get(key);
      if (seen != null) {
        return seen;
      }
      Optional<Job> existing = jobStore.findLiveByIdempotencyKey(conn, key);
      if (existing.isPresent()) {
        logger.log(Level.FINE, "Idempotency key {0} matched existing job {1}",
            new Object[]{key, existing.get().id()});
        return existing.get().id();
      }
    }
    jobStore.insert(conn, request);
    if (!request.dependsOn().isEmpty()) {
      jobStore.insertDependencies(conn, request.jobId(), request.dependsOn());
    }
    metrics.incrementEnqueued();
    return request.jobId();
  }

  /**
   * Cancels a PENDING job.
   *
   * @return {@code true} if the job was cancelled, {@code false} if it was not PENDING,
   *     does not exist, or the update failed
   */
  public boolean cancel(String jobId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return jobStore.cancel(conn, jobId, clock.instant()) > 0;
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to cancel job: " + jobId, e);
      return false;
    }
  }

  /**
   * Returns a FAILED or DEAD_LETTER job to PENDING.
   *
   * @param jobId           the job to retry
   * @param resetRetryCount whether the retry count starts again from 0
   * @return {@code true} if the job was reset, {@code false} if it was in another status,
   *     does not exist, or the update failed
   */
  public boolean retryFailed(String jobId, boolean resetRetryCount) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return jobStore.resetForRetry(conn, jobId, resetRetryCount) > 0;
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to retry job: " + jobId, e);
      return false;
    }
  }

  public Optional<Job> getJob(String jobId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.findById(conn, jobId);
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to load job: " + jobId, e);
      return Optional.empty();
    }
  }

  public Optional<JobStatus> getJobStatus(String jobId) {
    return getJob(jobId).map(Job::status);
  }

  /**
   * Returns the IDs of the jobs the given job waits for.
   */
  public List<String> getDependencies(String jobId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.findDependencies(conn, jobId);
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to load dependencies of job: " + jobId, e);
      return List.of();
    }
  }

  /**
   * Counts PENDING jobs, optionally for one operation type.
   *
   * @param operationType operation type filter ({@code null} for all)
   */
  public int getPendingCount(String operationType) {
    Map<String, Integer> pending = loadCounts().getOrDefault(JobStatus.PENDING, Map.of());
    if (operationType == null) {
      return pending.values().stream().mapToInt(Integer::intValue).sum();
    }
    return pending.getOrDefault(operationType, 0);
  }

  /**
   * Returns DEAD_LETTER jobs, most recently failed first.
   *
   * @param operationType operation type filter ({@code null} for all)
   * @param limit         maximum number of jobs to return
   */
  public List<Job> getDeadLetterJobs(String operationType, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.queryByStatus(conn, JobStatus.DEAD_LETTER, operationType, limit);
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to query dead letter jobs", e);
      return List.of();
    }
  }

  /**
   * Returns job counts in total, by status and by operation type.
   */
  public QueueStats getQueueStats() {
    Map<JobStatus, Map<String, Integer>> counts = loadCounts();
    Map<JobStatus, Integer> byStatus = new EnumMap<>(JobStatus.class);
    Map<String, Integer> byType = new TreeMap<>();
    int total = 0;
    for (Map.Entry<JobStatus, Map<String, Integer>> statusEntry : counts.entrySet()) {
      for (Map.Entry<String, Integer> typeEntry : statusEntry.getValue().entrySet()) {
        int n = typeEntry.getValue();
        total += n;
        byStatus.merge(statusEntry.getKey(), n, Integer::sum);
        byType.merge(typeEntry.getKey(), n, Integer::sum);
      }
    }
    return new QueueStats(total, byStatus, byType);
  }

  private Map<JobStatus, Map<String, Integer>> loadCounts() {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.countByStatusAndType(conn);
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to count jobs", e);
      return Map.of();
    }
  }

  /**
   * Deletes COMPLETED jobs that finished more than {@code olderThanDays} days ago.
   *
   * @return the number of jobs deleted
   */
  public int clearCompleted(int olderThanDays) {
    if (olderThanDays < 0) {
      throw new IllegalArgumentException("olderThanDays must be >= 0");
    }
    return clearCompletedBefore(clock.instant().minus(Duration.ofDays(olderThanDays)), CLEAR_BATCH_SIZE);
  }

  /**
   * Deletes COMPLETED jobs finished before {@code cutoff}, {@code batchSize} rows per
   * statement until a statement deletes fewer.
   *
   * @return the number of jobs deleted
   */
  public int clearCompletedBefore(Instant cutoff, int batchSize) {
    int total = 0;
    int deleted;
    do {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        deleted = jobStore.deleteCompletedBefore(conn, cutoff, batchSize);
      } catch (SQLException | JobStoreException e) {
        logger.log(Level.SEVERE, "Failed to delete completed jobs", e);
        break;
      }
      total += deleted;
    } while (deleted >= batchSize);
    return total;
  }

  private <T> T inTransaction(String description, TransactionWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.run(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new JobStoreException("Failed to " + description, e);
    }
  }

  @FunctionalInterface
  private interface TransactionWork<T> {
    T run(Connection conn) throws SQLException;
  }
}
