package jobflow.ratelimit;

import jobflow.util.Sleeper;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-tenant rate limiter for outbound calls such as LLM or OCR APIs.
 *
 * <p>Each tenant has its own request, token and cost counters. Requests per minute are
 * tracked as a sliding log, so no trailing 60-second window ever holds more than
 * {@code requestsPerMinute} acquisitions. Hour, day, token and cost counters use fixed
 * windows that start with the first use and reset when they roll over.
 *
 * <p>On top of the tenant counters, one token bucket shared by all tenants paces bursts:
 * capacity {@code burstSize}, refilled at {@code requestsPerMinute / 60} tokens per second,
 * starting full.
 *
 * <p>{@link #acquire} blocks until every limit allows the call. While waiting it sleeps
 * without holding the lock, for the shortest time after which one of the violated limits
 * resets, then checks again. There is no deadline.
 *
 * <p>State lives in this process only; several processes sharing a quota each enforce
 * the full limit.
 */
public final class RateLimiter {
  private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

  public static final String DEFAULT_TENANT = "default";

  static final long MINUTE_MS = 60_000L;
  static final long HOUR_MS = 3_600_000L;
  static final long DAY_MS = 86_400_000L;

  private final RateLimitConfig config;
  private final Clock clock;
  private final Sleeper sleeper;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, TenantWindows> tenants = new HashMap<>();
  private double bucketTokens;
  private long bucketRefilledAt;

  public RateLimiter(RateLimitConfig config) {
    this(config, Clock.systemUTC(), Sleeper.SYSTEM);
  }

  public RateLimiter(RateLimitConfig config, Clock clock, Sleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.bucketTokens = config.burstSize();
    this.bucketRefilledAt = clock.millis();
  }

  public RateLimitConfig config() {
    return config;
  }

  /**
   * Blocks until a request for the tenant is allowed, then counts it.
   *
   * @param tenantId the tenant, {@code null} for {@value #DEFAULT_TENANT}
   * @throws InterruptedException if interrupted while waiting; nothing is counted
   */
  public void acquire(String tenantId) throws InterruptedException {
    String tenant = tenantKey(tenantId);
    while (true) {
      long waitMs;
      lock.lock();
      try {
        long now = clock.millis();
        refillBucket(now);
        TenantWindows windows = windowsFor(tenant, now);
        waitMs = waitMs(windows, now);
        if (waitMs == 0L) {
          windows.recordRequest(now);
          bucketTokens -= 1.0;
          return;
        }
      } finally {
        lock.unlock();
      }
      logger.log(Level.FINE, "Rate limit reached for tenant {0}, waiting {1} ms",
          new Object[]{tenant, waitMs});
      sleeper.sleep(waitMs);
    }
  }

  /**
   * Acquires for the tenant, then runs the call.
   *
   * @throws Exception whatever the call throws, or {@link InterruptedException} while waiting
   */
  public <T> T call(String tenantId, Callable<T> call) throws Exception {
    acquire(tenantId);
    return call.call();
  }

  /**
   * Adds token and cost usage to the tenant's counters without any gating.
   * Subsequent {@link #acquire} calls wait once a token or cost limit is reached.
   *
   * @param tenantId the tenant, {@code null} for {@value #DEFAULT_TENANT}
   * @param tokens   tokens consumed (negative values are ignored)
   * @param cost     cost incurred (negative values are ignored)
   */
  public void recordUsage(String tenantId, long tokens, double cost) {
    String tenant = tenantKey(tenantId);
    lock.lock();
    try {
      windowsFor(tenant, clock.millis()).recordUsage(Math.max(0L, tokens), Math.max(0.0, cost));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the tenant's current counters.
   */
  public TenantUsage getUsage(String tenantId) {
    String tenant = tenantKey(tenantId);
    lock.lock();
    try {
      long now = clock.millis();
      refillBucket(now);
      TenantWindows w = windowsFor(tenant, now);
      return new TenantUsage(tenant, w.requestLog.size(), w.requestsThisHour, w.requestsToday,
          w.tokensThisMinute, w.tokensToday, w.costToday, (int) Math.floor(bucketTokens), config);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns how long the calling thread would wait right now, without acquiring.
   */
  public long currentWaitMs(String tenantId) {
    String tenant = tenantKey(tenantId);
    lock.lock();
    try {
      long now = clock.millis();
      refillBucket(now);
      return waitMs(windowsFor(tenant, now), now);
    } finally {
      lock.unlock();
    }
  }

  private static String tenantKey(String tenantId) {
    return tenantId == null || tenantId.isEmpty() ? DEFAULT_TENANT : tenantId;
  }

  private TenantWindows windowsFor(String tenant, long now) {
    TenantWindows windows = tenants.computeIfAbsent(tenant, ignored -> new TenantWindows(now));
    windows.roll(now);
    return windows;
  }

  private void refillBucket(long now) {
    long elapsed = now - bucketRefilledAt;
    if (elapsed > 0) {
      double refill = elapsed * (double) config.requestsPerMinute() / MINUTE_MS;
      bucketTokens = Math.min(config.burstSize(), bucketTokens + refill);
      bucketRefilledAt = now;
    }
  }

  /**
   * Returns 0 when every limit allows a request, otherwise the shortest wait after
   * which one of the violated limits resets (at least 1 ms).
   */
  private long waitMs(TenantWindows w, long now) {
    long wait = Long.MAX_VALUE;
    boolean violated = false;

    if (w.requestLog.size() >= config.requestsPerMinute()) {
      violated = true;
      wait = Math.min(wait, w.requestLog.peekFirst() + MINUTE_MS - now);
    }
    if (w.requestsThisHour >= config.requestsPerHour()) {
      violated = true;
      wait = Math.min(wait, w.hourStart + HOUR_MS - now);
    }
    if (w.requestsToday >= config.requestsPerDay()) {
      violated = true;
      wait = Math.min(wait, w.dayStart + DAY_MS - now);
    }
    if (config.tokensPerMinute().isPresent()
        && w.tokensThisMinute >= config.tokensPerMinute().getAsLong()) {
      violated = true;
      wait = Math.min(wait, w.minuteStart + MINUTE_MS - now);
    }
    if (config.tokensPerDay().isPresent()
        && w.tokensToday >= config.tokensPerDay().getAsLong()) {
      violated = true;
      wait = Math.min(wait, w.dayStart + DAY_MS - now);
    }
    if (config.costPerDay().isPresent()
        && w.costToday >= config.costPerDay().getAsDouble()) {
      violated = true;
      wait = Math.min(wait, w.dayStart + DAY_MS - now);
    }
    if (bucketTokens < 1.0) {
      violated = true;
      double missing = 1.0 - bucketTokens;
      wait = Math.min(wait, (long) Math.ceil(missing * MINUTE_MS / config.requestsPerMinute()));
    }

    if (!violated) {
      return 0L;
    }
    if (wait == Long.MAX_VALUE) {
      wait = config.burstCooldown().toMillis();
    }
    return Math.max(1L, wait);
  }

  /** Counters of one tenant. Guarded by the limiter's lock. */
  private static final class TenantWindows {
    final Deque<Long> requestLog = new ArrayDeque<>();
    long minuteStart;
    long hourStart;
    long dayStart;
    int requestsThisHour;
    int requestsToday;
    long tokensThisMinute;
    long tokensToday;
    double costToday;

    TenantWindows(long now) {
      this.minuteStart = now;
      this.hourStart = now;
      this.dayStart = now;
    }

    void roll(long now) {
      while (!requestLog.isEmpty() && requestLog.peekFirst() <= now - MINUTE_MS) {
        requestLog.pollFirst();
      }
      if (now - minuteStart >= MINUTE_MS) {
        minuteStart = now;
        tokensThisMinute = 0;
      }
      if (now - hourStart >= HOUR_MS) {
        hourStart = now;
        requestsThisHour = 0;
      }
      if (now - dayStart >= DAY_MS) {
        dayStart = now;
        requestsToday = 0;
        tokensToday = 0;
        costToday = 0.0;
      }
    }

    void recordRequest(long now) {
      requestLog.addLast(now);
      requestsThisHour++;
      requestsToday++;
    }

    void recordUsage(long tokens, double cost) {
      tokensThisMinute += tokens;
      tokensToday += tokens;
      costToday += cost;
    }
  }
}
