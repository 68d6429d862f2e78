package jobflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jobflow.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobflow.jobs.enqueued}</li>
 *   <li>{@code jobflow.jobs.claimed}</li>
 *   <li>{@code jobflow.jobs.completed}</li>
 *   <li>{@code jobflow.jobs.retried} (failed attempts re-queued)</li>
 *   <li>{@code jobflow.jobs.dead_lettered}</li>
 *   <li>{@code jobflow.jobs.failed} (terminal failures without retry)</li>
 *   <li>{@code jobflow.jobs.stale_recovered}</li>
 *   <li>{@code jobflow.deliveries}, tagged {@code connector} and {@code outcome}</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code jobflow.jobs.active}: jobs executing on the worker</li>
 *   <li>{@code jobflow.jobs.duration}: handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter enqueued;
  private final Counter claimed;
  private final Counter completed;
  private final Counter retried;
  private final Counter deadLettered;
  private final Counter failed;
  private final Counter staleRecovered;
  private final Timer jobDuration;
  private final Gauge activeGauge;
  private final Map<String, Counter> deliveryCounters = new ConcurrentHashMap<>();

  private final AtomicInteger activeJobs = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "jobflow");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.jobflow"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.enqueued = counter("jobs.enqueued", "Jobs enqueued");
    this.claimed = counter("jobs.claimed", "Jobs claimed by a worker");
    this.completed = counter("jobs.completed", "Jobs completed successfully");
    this.retried = counter("jobs.retried", "Failed attempts re-queued for retry");
    this.deadLettered = counter("jobs.dead_lettered", "Jobs moved to DEAD_LETTER");
    this.failed = counter("jobs.failed", "Jobs failed without retry");
    this.staleRecovered = counter("jobs.stale_recovered", "Stale PROCESSING jobs returned to PENDING");
    this.jobDuration = Timer.builder(namePrefix + ".jobs.duration")
        .description("Handler execution time")
        .register(registry);
    this.activeGauge = Gauge.builder(namePrefix + ".jobs.active", activeJobs, AtomicInteger::get)
        .description("Jobs executing on the worker")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(namePrefix + "." + name)
        .description(description)
        .register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementDeadLettered() {
    if (closed) return;
    deadLettered.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementStaleRecovered(int count) {
    if (closed || count <= 0) return;
    staleRecovered.increment(count);
  }

  @Override
  public void recordActiveJobs(int active) {
    if (closed) return;
    activeJobs.set(active);
  }

  @Override
  public void recordJobDurationMs(long durationMs) {
    if (closed) return;
    jobDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordDelivery(String connectorType, boolean success) {
    if (closed) return;
    String outcome = success ? "success" : "failure";
    deliveryCounters.computeIfAbsent(connectorType + "|" + outcome,
        key -> Counter.builder(namePrefix + ".deliveries")
            .description("Connector deliveries by final outcome")
            .tag("connector", connectorType)
            .tag("outcome", outcome)
            .register(registry))
        .increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(enqueued, claimed, completed, retried,
        deadLettered, failed, staleRecovered, jobDuration, activeGauge));
    meters.addAll(deliveryCounters.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
