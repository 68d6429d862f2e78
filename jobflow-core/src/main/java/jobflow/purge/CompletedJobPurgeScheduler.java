package jobflow.purge;

import jobflow.spi.ConnectionProvider;
import jobflow.spi.JobStore;
import jobflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically deletes COMPLETED jobs that finished longer ago than the retention period.
 *
 * <p>Each cycle deletes in batches until a batch comes back short. Every batch runs on
 * its own auto-committed connection to keep lock time short. FAILED, DEAD_LETTER and
 * CANCELLED jobs are never purged.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see jobflow.JobQueue#clearCompleted(int)
 */
public final class CompletedJobPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CompletedJobPurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final Duration retention;
  private final int batchSize;
  private final Duration interval;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private CompletedJobPurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    Objects.requireNonNull(builder.retention, "retention");
    Objects.requireNonNull(builder.interval, "interval");
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.retention = builder.retention;
    this.batchSize = builder.batchSize;
    this.interval = builder.interval;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the purge schedule. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("CompletedJobPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobflow-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one purge cycle. May be invoked directly for testing or one-off purges.
   *
   * @return the number of jobs deleted
   */
  public long runOnce() {
    if (closed) {
      return 0L;
    }
    try {
      Instant cutoff = clock.instant().minus(retention);
      long total = 0L;
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        total += deleted;
      } while (deleted >= batchSize);
      if (total > 0) {
        logger.log(Level.INFO, "Purged {0} completed jobs older than {1}", new Object[]{total, cutoff});
      }
      return total;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Purge cycle failed", t);
      return 0L;
    }
  }

  private int purgeBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return jobStore.deleteCompletedBefore(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link CompletedJobPurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private Duration retention = Duration.ofDays(30);
    private int batchSize = 500;
    private Duration interval = Duration.ofHours(1);
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * How long COMPLETED jobs are kept after they finish.
     *
     * <p>Optional. Defaults to {@code 30 days}. Must be &ge; 0.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /** Optional. Defaults to {@code 500}. Must be &gt; 0. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to {@code 1 hour}. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public CompletedJobPurgeScheduler build() {
      return new CompletedJobPurgeScheduler(this);
    }
  }
}
