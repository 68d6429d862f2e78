package jobflow.worker;

import jobflow.model.Job;
import jobflow.ratelimit.RateLimiter;
import jobflow.spi.ConnectionProvider;
import jobflow.spi.JobStore;
import jobflow.spi.MetricsExporter;
import jobflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls the job store, claims eligible jobs and runs their handlers.
 *
 * <p>Each poll cycle first recovers stale PROCESSING jobs, then selects up to
 * {@code min(batchSize, free slots)} eligible jobs, oldest first, and hands each one to
 * the job pool. There the job waits on the {@link RateLimiter} (when configured) and is
 * then claimed with a conditional update. Only jobs this worker claimed are executed, so
 * several workers (in one process or many) can share a store. Rate limiting happens
 * before the claim, so a job never sits in PROCESSING while it waits for quota.
 *
 * <p>Outcome of an attempt:
 * <ul>
 *   <li>handler returns: COMPLETED with the result's string form</li>
 *   <li>no handler for the operation type, or the subject no longer exists: FAILED, no retry</li>
 *   <li>handler throws or exceeds {@code jobTimeout}: PENDING again after
 *       {@link RetryPolicy} backoff while {@code retryCount < maxRetries}, otherwise
 *       DEAD_LETTER</li>
 * </ul>
 *
 * <p>At most {@code maxConcurrent} handlers run at once. A handler that exceeds the timeout
 * is interrupted and its attempt recorded as failed, but it keeps its slot until it
 * actually returns.
 *
 * <p>A PROCESSING job whose claim is older than {@code staleJobTimeout} (which must exceed
 * {@code jobTimeout}) belongs to a worker that died. The sweep counts the lost attempt as
 * a failure: the job goes back to PENDING with {@code retryCount + 1}, or to DEAD_LETTER
 * once {@code maxRetries} is used up. Every status update after a claim is fenced on the
 * claim's {@code startedAt}, so an attempt that lost its claim cannot overwrite a later one.
 *
 * <p>Create instances via {@link #builder(SubjectResolver)}. {@link #start()} and
 * {@link #close()} are synchronized.
 *
 * @param <S> subject type handed to handlers
 * @see Worker.Builder
 */
public final class Worker<S> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Worker.class.getName());

  static final String TIMEOUT_ERROR = "Job timeout";
  static final String STALE_ERROR = "Stale job recovered";
  static final String DEAD_LETTER_PREFIX = "Max retries exceeded. Last error: ";

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final HandlerRegistry<S> handlerRegistry;
  private final SubjectResolver<S> subjectResolver;
  private final RateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration pollInterval;
  private final int batchSize;
  private final int maxConcurrent;
  private final int maxRetries;
  private final Duration jobTimeout;
  private final Duration staleJobTimeout;
  private final Duration shutdownTimeout;
  private final Set<String> operationTypes;

  private final Semaphore slots;
  private final Set<String> reserved = ConcurrentHashMap.newKeySet();
  private final ExecutorService jobPool;
  private final ExecutorService handlerPool;
  private final AtomicInteger activeJobs = new AtomicInteger();
  private final AtomicLong processedCount = new AtomicLong();
  private final AtomicLong retriedCount = new AtomicLong();
  private final AtomicLong failedCount = new AtomicLong();

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile Instant startedAt;
  private volatile boolean closed;

  private Worker(Builder<S> builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.subjectResolver = Objects.requireNonNull(builder.subjectResolver, "subjectResolver");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.maxConcurrent <= 0) {
      throw new IllegalArgumentException("maxConcurrent must be > 0");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    requirePositive(builder.pollInterval, "pollInterval");
    requirePositive(builder.jobTimeout, "jobTimeout");
    requireNonNegative(builder.staleJobTimeout, "staleJobTimeout");
    if (!builder.staleJobTimeout.isZero() && builder.staleJobTimeout.compareTo(builder.jobTimeout) <= 0) {
      throw new IllegalArgumentException("staleJobTimeout must be greater than jobTimeout, got: "
          + builder.staleJobTimeout + " <= " + builder.jobTimeout);
    }
    requireNonNegative(builder.shutdownTimeout, "shutdownTimeout");

    this.pollInterval = builder.pollInterval;
    this.batchSize = builder.batchSize;
    this.maxConcurrent = builder.maxConcurrent;
    this.maxRetries = builder.maxRetries;
    this.jobTimeout = builder.jobTimeout;
    this.staleJobTimeout = builder.staleJobTimeout;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.operationTypes = Set.copyOf(builder.operationTypes);
    this.rateLimiter = builder.rateLimiter;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(builder.retryDelayBase.toMillis(), builder.retryDelayMax.toMillis());
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    this.slots = new Semaphore(maxConcurrent);
    this.jobPool = Executors.newFixedThreadPool(maxConcurrent, new DaemonThreadFactory("jobflow-worker-"));
    this.handlerPool = Executors.newFixedThreadPool(maxConcurrent, new DaemonThreadFactory("jobflow-handler-"));
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  private static void requireNonNegative(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must be >= 0");
    }
  }

  /**
   * Creates a builder for a worker whose handlers receive subjects from {@code subjectResolver}.
   */
  public static <S> Builder<S> builder(SubjectResolver<S> subjectResolver) {
    return new Builder<>(subjectResolver);
  }

  /**
   * Starts the scheduled poll loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Worker has been closed");
    }
    if (pollTask != null) {
      return;
    }
    startedAt = clock.instant();
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobflow-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(
        this::poll, 0L, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Worker started: types={0}, maxConcurrent={1}, pollInterval={2}",
        new Object[]{pollTypes(), maxConcurrent, pollInterval});
  }

  /**
   * Executes a single poll cycle. Called automatically by the scheduler, but may also
   * be invoked directly for testing.
   *
   * @return the number of jobs handed to the job pool; each is claimed there
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    try {
      recoverStaleJobs();

      int free = slots.availablePermits();
      if (free <= 0) {
        return 0;
      }
      Set<String> types = pollTypes();
      if (types.isEmpty()) {
        return 0;
      }
      List<Job> candidates = fetchCandidates(types, Math.min(batchSize, free));
      int dispatched = 0;
      for (Job candidate : candidates) {
        if (closed) {
          break;
        }
        if (!reserved.add(candidate.id())) {
          continue;
        }
        if (!slots.tryAcquire()) {
          reserved.remove(candidate.id());
          break;
        }
        if (dispatch(candidate)) {
          dispatched++;
        }
      }
      return dispatched;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Poll cycle failed", t);
      return 0;
    }
  }

  private Set<String> pollTypes() {
    if (!operationTypes.isEmpty()) {
      return operationTypes;
    }
    return handlerRegistry.operationTypes();
  }

  private void recoverStaleJobs() {
    if (staleJobTimeout.isZero()) {
      return;
    }
    Instant now = clock.instant();
    Instant cutoff = now.minus(staleJobTimeout);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int deadLettered = jobStore.deadLetterStale(conn, cutoff, maxRetries, DEAD_LETTER_PREFIX + STALE_ERROR, now);
      int recovered = jobStore.requeueStale(conn, cutoff, STALE_ERROR);
      for (int i = 0; i < deadLettered; i++) {
        failedCount.incrementAndGet();
        metrics.incrementDeadLettered();
      }
      if (deadLettered > 0) {
        logger.log(Level.SEVERE, "Moved {0} stale jobs claimed before {1} to DEAD_LETTER",
            new Object[]{deadLettered, cutoff});
      }
      if (recovered > 0) {
        metrics.incrementStaleRecovered(recovered);
        logger.log(Level.WARNING, "Recovered {0} stale jobs claimed before {1}",
            new Object[]{recovered, cutoff});
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to recover stale jobs", e);
    }
  }

  private List<Job> fetchCandidates(Collection<String> types, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return jobStore.pollPending(conn, types, clock.instant(), limit);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch pending jobs", e);
      return List.of();
    }
  }

  private Optional<Job> claim(String jobId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        Optional<Job> claimed = jobStore.claim(conn, jobId, clock.instant().truncatedTo(ChronoUnit.MICROS));
        conn.commit();
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to claim job " + jobId, e);
      return Optional.empty();
    }
  }

  private boolean dispatch(Job candidate) {
    try {
      jobPool.execute(() -> execute(candidate));
      return true;
    } catch (RejectedExecutionException e) {
      reserved.remove(candidate.id());
      slots.release();
      logger.log(Level.FINE, "Worker is shutting down; job {0} stays PENDING", candidate.id());
      return false;
    }
  }

  private void execute(Job candidate) {
    boolean slotHandedOff = false;
    try {
      Optional<Job> claimed = acquireAndClaim(candidate);
      if (claimed.isEmpty()) {
        return;
      }
      metrics.incrementClaimed();
      Job job = claimed.get();
      long start = System.nanoTime();
      Optional<JobHandler<S>> handler = handlerRegistry.handlerFor(job.operationType());
      if (handler.isEmpty()) {
        fail(job, "No handler registered for operation type: " + job.operationType());
        return;
      }
      HandlerCall call = new HandlerCall(handler.get(), job);
      Future<Object> future;
      try {
        future = handlerPool.submit(call);
      } catch (RejectedExecutionException e) {
        logger.log(Level.WARNING, "Worker is shutting down; job {0} stays PROCESSING until recovered",
            job.id());
        return;
      }
      slotHandedOff = true;
      awaitOutcome(job, call, future);
      metrics.recordJobDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.FINE, "Interrupted before claiming job {0}; it stays PENDING", candidate.id());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Unexpected failure while executing job " + candidate.id(), t);
    } finally {
      if (!slotHandedOff) {
        slots.release();
      }
    }
  }

  private Optional<Job> acquireAndClaim(Job candidate) throws InterruptedException {
    try {
      if (rateLimiter != null) {
        rateLimiter.acquire(candidate.tenantId());
      }
      return claim(candidate.id());
    } finally {
      reserved.remove(candidate.id());
    }
  }

  private void awaitOutcome(Job job, HandlerCall call, Future<Object> future) {
    Object result;
    try {
      result = future.get(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      abandon(call, future);
      logger.log(Level.WARNING, "Job {0} exceeded timeout of {1}", new Object[]{job.id(), jobTimeout});
      retryOrDeadLetter(job, TIMEOUT_ERROR);
      return;
    } catch (InterruptedException e) {
      abandon(call, future);
      Thread.currentThread().interrupt();
      retryOrDeadLetter(job, "Interrupted");
      return;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof SubjectNotFoundException) {
        fail(job, cause.getMessage());
        return;
      }
      logger.log(Level.WARNING, "Job " + job.id() + " failed on attempt " + (job.retryCount() + 1), cause);
      retryOrDeadLetter(job, describe(cause));
      return;
    }
    complete(job, result);
  }

  private void abandon(HandlerCall call, Future<Object> future) {
    future.cancel(true);
    call.abandon();
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    return message != null && !message.isEmpty() ? message : t.getClass().getName();
  }

  private void complete(Job job, Object result) {
    String value = result == null ? null : result.toString();
    int updated = update(job.id(), "mark COMPLETED",
        conn -> jobStore.markCompleted(conn, job.id(), job.startedAt(), value, clock.instant()));
    if (updated > 0) {
      processedCount.incrementAndGet();
      metrics.incrementCompleted();
    }
  }

  private void fail(Job job, String error) {
    logger.log(Level.WARNING, "Job {0} failed without retry: {1}", new Object[]{job.id(), error});
    int updated = update(job.id(), "mark FAILED",
        conn -> jobStore.markFailed(conn, job.id(), job.startedAt(), error, clock.instant()));
    if (updated > 0) {
      failedCount.incrementAndGet();
      metrics.incrementFailed();
    }
  }

  private void retryOrDeadLetter(Job job, String error) {
    if (job.retryCount() < maxRetries) {
      long delayMs = retryPolicy.computeDelayMs(job.retryCount());
      Instant retryAfter = clock.instant().plusMillis(delayMs);
      int updated = update(job.id(), "mark for retry",
          conn -> jobStore.markRetry(conn, job.id(), job.startedAt(), retryAfter, error));
      if (updated > 0) {
        retriedCount.incrementAndGet();
        metrics.incrementRetried();
        logger.log(Level.INFO, "Job {0} scheduled for retry {1}/{2} after {3} ms",
            new Object[]{job.id(), job.retryCount() + 1, maxRetries, delayMs});
      }
      return;
    }
    String finalError = DEAD_LETTER_PREFIX + error;
    int updated = update(job.id(), "move to DEAD_LETTER",
        conn -> jobStore.markDeadLetter(conn, job.id(), job.startedAt(), finalError, clock.instant()));
    if (updated > 0) {
      failedCount.incrementAndGet();
      metrics.incrementDeadLettered();
      logger.log(Level.SEVERE, "Job {0} moved to DEAD_LETTER after {1} attempts: {2}",
          new Object[]{job.id(), job.retryCount() + 1, error});
    }
  }

  private int update(String jobId, String action, StoreUpdate op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = op.apply(conn);
      if (updated == 0) {
        logger.log(Level.WARNING, "Could not {0} for job {1}: no longer held by this attempt",
            new Object[]{action, jobId});
      }
      return updated;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for job " + jobId, e);
      return 0;
    }
  }

  /**
   * Returns a snapshot of this worker's counters.
   */
  public WorkerStats getStats() {
    Instant started = startedAt;
    Duration uptime = started == null ? Duration.ZERO : Duration.between(started, clock.instant());
    return new WorkerStats(isRunning(), activeJobs.get(), processedCount.get(), retriedCount.get(),
        failedCount.get(), uptime, handlerRegistry.operationTypes().size());
  }

  public boolean isRunning() {
    return pollTask != null && !closed;
  }

  /**
   * Stops polling and waits up to {@code shutdownTimeout} for running jobs.
   */
  public void stop() {
    close();
  }

  /**
   * Stops polling and waits up to {@code shutdownTimeout} for running jobs to finish.
   * Jobs still running afterwards are left PROCESSING; the stale-job sweep of any
   * worker returns them to PENDING later.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
    jobPool.shutdown();
    try {
      if (!jobPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Worker stopped with {0} jobs still running; they remain PROCESSING",
            activeJobs.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    handlerPool.shutdown();
    logger.log(Level.INFO, "Worker stopped: processed={0}, failed={1}",
        new Object[]{processedCount.get(), failedCount.get()});
  }

  @FunctionalInterface
  private interface StoreUpdate {
    int apply(Connection conn) throws SQLException;
  }

  /**
   * Resolves the subject and runs the handler on the handler pool. The call owns one
   * slot and releases it when it returns, or in {@link #abandon()} if it never started.
   */
  private final class HandlerCall implements Callable<Object> {
    private final JobHandler<S> handler;
    private final Job job;
    private final AtomicBoolean taken = new AtomicBoolean();

    HandlerCall(JobHandler<S> handler, Job job) {
      this.handler = handler;
      this.job = job;
    }

    @Override
    public Object call() throws Exception {
      if (!taken.compareAndSet(false, true)) {
        return null;
      }
      metrics.recordActiveJobs(activeJobs.incrementAndGet());
      try {
        Optional<S> subject = subjectResolver.resolve(job.subjectId());
        if (subject.isEmpty()) {
          throw new SubjectNotFoundException(job.subjectId());
        }
        return handler.execute(job, subject.get());
      } finally {
        metrics.recordActiveJobs(activeJobs.decrementAndGet());
        slots.release();
      }
    }

    void abandon() {
      if (taken.compareAndSet(false, true)) {
        slots.release();
      }
    }
  }

  private static final class SubjectNotFoundException extends Exception {
    SubjectNotFoundException(String subjectId) {
      super("Subject not found: " + subjectId, null, false, false);
    }
  }

  /**
   * Builder for {@link Worker}.
   */
  public static final class Builder<S> {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private HandlerRegistry<S> handlerRegistry;
    private final SubjectResolver<S> subjectResolver;
    private RateLimiter rateLimiter;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration pollInterval = Duration.ofSeconds(1);
    private int batchSize = 10;
    private int maxConcurrent = 5;
    private int maxRetries = 3;
    private Duration retryDelayBase = Duration.ofSeconds(5);
    private Duration retryDelayMax = Duration.ofSeconds(300);
    private Duration jobTimeout = Duration.ofSeconds(300);
    private Duration staleJobTimeout = Duration.ofSeconds(600);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private final Set<String> operationTypes = new LinkedHashSet<>();

    private Builder(SubjectResolver<S> subjectResolver) {
      this.subjectResolver = subjectResolver;
    }

    /**
     * Sets the connection provider used for polling, claiming and status updates.
     *
     * <p><b>Required.</b>
     */
    public Builder<S> connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder<S> jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder<S> handlerRegistry(HandlerRegistry<S> handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Gates every job on {@link RateLimiter#acquire} for its tenant before it is claimed.
     * A job whose claim is then lost to another worker still used its quota.
     *
     * <p>Optional. No gating by default.
     */
    public Builder<S> rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Overrides the backoff computed from {@link #retryDelayBase} and {@link #retryDelayMax}.
     */
    public Builder<S> retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder<S> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder<S> clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@code 1s}. Must be positive. */
    public Builder<S> pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /** Maximum jobs claimed per poll cycle. Optional. Defaults to {@code 10}. */
    public Builder<S> batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Maximum jobs running at once. Optional. Defaults to {@code 5}. */
    public Builder<S> maxConcurrent(int maxConcurrent) {
      this.maxConcurrent = maxConcurrent;
      return this;
    }

    /**
     * Failed attempts re-queued before a job goes to DEAD_LETTER; a job runs at most
     * {@code maxRetries + 1} times. Optional. Defaults to {@code 3}.
     */
    public Builder<S> maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /** Optional. Defaults to {@code 5s}. */
    public Builder<S> retryDelayBase(Duration retryDelayBase) {
      this.retryDelayBase = Objects.requireNonNull(retryDelayBase, "retryDelayBase");
      return this;
    }

    /** Optional. Defaults to {@code 300s}. */
    public Builder<S> retryDelayMax(Duration retryDelayMax) {
      this.retryDelayMax = Objects.requireNonNull(retryDelayMax, "retryDelayMax");
      return this;
    }

    /** Optional. Defaults to {@code 300s}. Must be positive. */
    public Builder<S> jobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
      return this;
    }

    /**
     * PROCESSING jobs claimed longer ago than this are treated as abandoned by a dead
     * worker and recovered by the poll cycle. Must be greater than {@link #jobTimeout}.
     * Optional. Defaults to {@code 600s}; {@link Duration#ZERO} disables recovery.
     */
    public Builder<S> staleJobTimeout(Duration staleJobTimeout) {
      this.staleJobTimeout = staleJobTimeout;
      return this;
    }

    /** Optional. Defaults to {@code 30s}. */
    public Builder<S> shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * Restricts polling to these operation types. Jobs of a listed type without a
     * handler are failed. Optional. By default every type with a registered handler
     * is polled.
     */
    public Builder<S> operationTypes(Collection<String> operationTypes) {
      this.operationTypes.clear();
      this.operationTypes.addAll(operationTypes);
      return this;
    }

    public Builder<S> operationTypes(String... operationTypes) {
      return operationTypes(List.of(operationTypes));
    }

    /**
     * Builds the worker. Call {@link Worker#start()} to begin polling.
     *
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a size or duration is out of range
     */
    public Worker<S> build() {
      return new Worker<>(this);
    }
  }
}
