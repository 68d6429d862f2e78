package jobflow.ratelimit;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Limits enforced by a {@link RateLimiter}.
 *
 * <p>Request limits are always active. Token and cost limits are optional and only
 * take effect once usage is reported through {@link RateLimiter#recordUsage}.
 *
 * <p>Create instances via {@link #builder()}; {@link #defaults()} gives 60/min,
 * 1000/h, 10000/day and a burst of 10.
 */
public final class RateLimitConfig {
  private final int requestsPerMinute;
  private final int requestsPerHour;
  private final int requestsPerDay;
  private final Long tokensPerMinute;
  private final Long tokensPerDay;
  private final Double costPerDay;
  private final int burstSize;
  private final Duration burstCooldown;

  private RateLimitConfig(Builder builder) {
    if (builder.requestsPerMinute <= 0) {
      throw new IllegalArgumentException("requestsPerMinute must be > 0");
    }
    if (builder.requestsPerHour <= 0) {
      throw new IllegalArgumentException("requestsPerHour must be > 0");
    }
    if (builder.requestsPerDay <= 0) {
      throw new IllegalArgumentException("requestsPerDay must be > 0");
    }
    if (builder.tokensPerMinute != null && builder.tokensPerMinute <= 0) {
      throw new IllegalArgumentException("tokensPerMinute must be > 0");
    }
    if (builder.tokensPerDay != null && builder.tokensPerDay <= 0) {
      throw new IllegalArgumentException("tokensPerDay must be > 0");
    }
    if (builder.costPerDay != null && !(builder.costPerDay > 0)) {
      throw new IllegalArgumentException("costPerDay must be > 0");
    }
    if (builder.burstSize <= 0) {
      throw new IllegalArgumentException("burstSize must be > 0");
    }
    Objects.requireNonNull(builder.burstCooldown, "burstCooldown");
    if (builder.burstCooldown.isNegative() || builder.burstCooldown.isZero()) {
      throw new IllegalArgumentException("burstCooldown must be positive");
    }
    this.requestsPerMinute = builder.requestsPerMinute;
    this.requestsPerHour = builder.requestsPerHour;
    this.requestsPerDay = builder.requestsPerDay;
    this.tokensPerMinute = builder.tokensPerMinute;
    this.tokensPerDay = builder.tokensPerDay;
    this.costPerDay = builder.costPerDay;
    this.burstSize = builder.burstSize;
    this.burstCooldown = builder.burstCooldown;
  }

  public static RateLimitConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int requestsPerMinute() {
    return requestsPerMinute;
  }

  public int requestsPerHour() {
    return requestsPerHour;
  }

  public int requestsPerDay() {
    return requestsPerDay;
  }

  public OptionalLong tokensPerMinute() {
    return tokensPerMinute == null ? OptionalLong.empty() : OptionalLong.of(tokensPerMinute);
  }

  public OptionalLong tokensPerDay() {
    return tokensPerDay == null ? OptionalLong.empty() : OptionalLong.of(tokensPerDay);
  }

  public OptionalDouble costPerDay() {
    return costPerDay == null ? OptionalDouble.empty() : OptionalDouble.of(costPerDay);
  }

  public int burstSize() {
    return burstSize;
  }

  public Duration burstCooldown() {
    return burstCooldown;
  }

  @Override
  public String toString() {
    return "RateLimitConfig{rpm=" + requestsPerMinute + ", rph=" + requestsPerHour
        + ", rpd=" + requestsPerDay + ", tpm=" + tokensPerMinute + ", tpd=" + tokensPerDay
        + ", costPerDay=" + costPerDay + ", burst=" + burstSize + "}";
  }

  /** Builder for {@link RateLimitConfig}. */
  public static final class Builder {
    private int requestsPerMinute = 60;
    private int requestsPerHour = 1000;
    private int requestsPerDay = 10_000;
    private Long tokensPerMinute;
    private Long tokensPerDay;
    private Double costPerDay;
    private int burstSize = 10;
    private Duration burstCooldown = Duration.ofSeconds(1);

    private Builder() {
    }

    /**
     * Requests allowed in any rolling 60-second window. Also sets the burst refill
     * rate to {@code requestsPerMinute / 60} per second.
     *
     * <p>Optional. Defaults to {@code 60}. Must be &gt; 0.
     */
    public Builder requestsPerMinute(int requestsPerMinute) {
      this.requestsPerMinute = requestsPerMinute;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. Must be &gt; 0. */
    public Builder requestsPerHour(int requestsPerHour) {
      this.requestsPerHour = requestsPerHour;
      return this;
    }

    /** Optional. Defaults to {@code 10000}. Must be &gt; 0. */
    public Builder requestsPerDay(int requestsPerDay) {
      this.requestsPerDay = requestsPerDay;
      return this;
    }

    /** Optional. Unlimited when {@code null}. */
    public Builder tokensPerMinute(Long tokensPerMinute) {
      this.tokensPerMinute = tokensPerMinute;
      return this;
    }

    /** Optional. Unlimited when {@code null}. */
    public Builder tokensPerDay(Long tokensPerDay) {
      this.tokensPerDay = tokensPerDay;
      return this;
    }

    /** Optional daily spend cap in the unit used by {@link CostTracker}. Unlimited when {@code null}. */
    public Builder costPerDay(Double costPerDay) {
      this.costPerDay = costPerDay;
      return this;
    }

    /**
     * Capacity of the shared token bucket, i.e. how many requests may go out
     * back-to-back before refill pacing applies.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder burstSize(int burstSize) {
      this.burstSize = burstSize;
      return this;
    }

    /**
     * Wait used when no violated limit yields a reset time.
     *
     * <p>Optional. Defaults to {@code 1s}. Must be positive.
     */
    public Builder burstCooldown(Duration burstCooldown) {
      this.burstCooldown = burstCooldown;
      return this;
    }

    public RateLimitConfig build() {
      return new RateLimitConfig(this);
    }
  }
}
