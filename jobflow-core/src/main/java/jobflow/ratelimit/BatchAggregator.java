package jobflow.ratelimit;

import jobflow.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Coalesces individual requests into batches for a {@link BatchProcessor}.
 *
 * <p>A batch is flushed when it reaches {@code batchSize} items or when {@code maxWait}
 * has passed since its first item, whichever comes first. Every caller receives the
 * result at its item's index. When the processor throws, or returns a list of the wrong
 * size, every caller in that batch sees the failure.
 *
 * <p>Flushes never overlap: {@code process} is called by one thread at a time. A size
 * flush runs on the thread whose item filled the batch; a time flush runs on the
 * aggregator's timer thread.
 *
 * <pre>{@code
 * try (BatchAggregator<String, float[]> embeddings = BatchAggregator.<String, float[]>builder()
 *     .processor(texts -> client.embed(texts))
 *     .batchSize(32)
 *     .maxWait(Duration.ofMillis(200))
 *     .build()) {
 *   float[] vector = embeddings.add("invoice total");
 * }
 * }</pre>
 *
 * @param <I> item type
 * @param <R> result type
 */
public final class BatchAggregator<I, R> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchAggregator.class.getName());

  private final BatchProcessor<I, R> processor;
  private final int batchSize;
  private final Duration maxWait;
  private final ScheduledExecutorService timer;

  private final ReentrantLock pendingLock = new ReentrantLock();
  private final ReentrantLock flushLock = new ReentrantLock();
  private List<Pending<I, R>> pending = new ArrayList<>();
  private ScheduledFuture<?> flushTimer;
  private volatile boolean closed;

  private BatchAggregator(Builder<I, R> builder) {
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    Objects.requireNonNull(builder.maxWait, "maxWait");
    if (builder.maxWait.isNegative() || builder.maxWait.isZero()) {
      throw new IllegalArgumentException("maxWait must be positive");
    }
    this.batchSize = builder.batchSize;
    this.maxWait = builder.maxWait;
    this.timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobflow-batch-"));
  }

  public static <I, R> Builder<I, R> builder() {
    return new Builder<>();
  }

  /**
   * Adds an item to the current batch.
   *
   * @return a future completed with the item's result, or exceptionally with the
   *     batch failure
   * @throws IllegalStateException if the aggregator has been closed
   */
  public CompletableFuture<R> submit(I item) {
    CompletableFuture<R> future = new CompletableFuture<>();
    List<Pending<I, R>> full = null;
    pendingLock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("BatchAggregator has been closed");
      }
      pending.add(new Pending<>(item, future));
      if (pending.size() >= batchSize) {
        full = takePending();
      } else if (pending.size() == 1) {
        flushTimer = timer.schedule(this::flush, maxWait.toMillis(), TimeUnit.MILLISECONDS);
      }
    } finally {
      pendingLock.unlock();
    }
    if (full != null) {
      process(full);
    }
    return future;
  }

  /**
   * Adds an item and waits for its result.
   *
   * @throws BatchProcessingException if the batch failed
   * @throws InterruptedException     if interrupted while waiting
   */
  public R add(I item) throws InterruptedException {
    try {
      return submit(item).get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof BatchProcessingException) {
        throw (BatchProcessingException) cause;
      }
      throw new BatchProcessingException("Batch processing failed", cause);
    }
  }

  /**
   * Processes whatever is pending now, if anything.
   */
  public void flush() {
    List<Pending<I, R>> batch;
    pendingLock.lock();
    try {
      batch = takePending();
    } finally {
      pendingLock.unlock();
    }
    if (!batch.isEmpty()) {
      process(batch);
    }
  }

  /** Number of items waiting for the next flush. */
  public int pendingCount() {
    pendingLock.lock();
    try {
      return pending.size();
    } finally {
      pendingLock.unlock();
    }
  }

  private List<Pending<I, R>> takePending() {
    List<Pending<I, R>> batch = pending;
    pending = new ArrayList<>();
    if (flushTimer != null) {
      flushTimer.cancel(false);
      flushTimer = null;
    }
    return batch;
  }

  private void process(List<Pending<I, R>> batch) {
    flushLock.lock();
    try {
      List<I> items = new ArrayList<>(batch.size());
      for (Pending<I, R> p : batch) {
        items.add(p.item);
      }
      List<R> results;
      try {
        results = processor.process(items);
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Batch of " + batch.size() + " items failed", t);
        BatchProcessingException failure = new BatchProcessingException(
            "Batch of " + batch.size() + " items failed: " + t.getMessage(), t);
        batch.forEach(p -> p.future.completeExceptionally(failure));
        return;
      }
      if (results == null || results.size() != batch.size()) {
        int got = results == null ? 0 : results.size();
        BatchProcessingException failure = new BatchProcessingException(
            "Batch processor returned " + got + " results for " + batch.size() + " items",
            new IllegalStateException("result count mismatch"));
        logger.warning(failure.getMessage());
        batch.forEach(p -> p.future.completeExceptionally(failure));
        return;
      }
      for (int i = 0; i < batch.size(); i++) {
        batch.get(i).future.complete(results.get(i));
      }
    } finally {
      flushLock.unlock();
    }
  }

  /**
   * Flushes pending items and stops the timer thread.
   */
  @Override
  public void close() {
    pendingLock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
    } finally {
      pendingLock.unlock();
    }
    flush();
    timer.shutdown();
  }

  private static final class Pending<I, R> {
    final I item;
    final CompletableFuture<R> future;

    Pending(I item, CompletableFuture<R> future) {
      this.item = item;
      this.future = future;
    }
  }

  /** Builder for {@link BatchAggregator}. */
  public static final class Builder<I, R> {
    private BatchProcessor<I, R> processor;
    private int batchSize = 10;
    private Duration maxWait = Duration.ofSeconds(1);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder<I, R> processor(BatchProcessor<I, R> processor) {
      this.processor = processor;
      return this;
    }

    /** Optional. Defaults to {@code 10}. Must be &gt; 0. */
    public Builder<I, R> batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to {@code 1s}. Must be positive. */
    public Builder<I, R> maxWait(Duration maxWait) {
      this.maxWait = maxWait;
      return this;
    }

    public BatchAggregator<I, R> build() {
      return new BatchAggregator<>(this);
    }
  }
}
