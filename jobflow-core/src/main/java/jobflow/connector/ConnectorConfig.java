package jobflow.connector;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by all connectors.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ConnectorConfig {
  private final String name;
  private final boolean enabled;
  private final int maxRetries;
  private final Duration retryDelay;
  private final Duration timeout;
  private final int batchSize;
  private final boolean deduplication;

  private ConnectorConfig(Builder builder) {
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    Objects.requireNonNull(builder.retryDelay, "retryDelay");
    if (builder.retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must be >= 0");
    }
    Objects.requireNonNull(builder.timeout, "timeout");
    if (builder.timeout.isNegative() || builder.timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.name = builder.name;
    this.enabled = builder.enabled;
    this.maxRetries = builder.maxRetries;
    this.retryDelay = builder.retryDelay;
    this.timeout = builder.timeout;
    this.batchSize = builder.batchSize;
    this.deduplication = builder.deduplication;
  }

  public static ConnectorConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String name() {
    return name;
  }

  public boolean enabled() {
    return enabled;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public Duration retryDelay() {
    return retryDelay;
  }

  public Duration timeout() {
    return timeout;
  }

  public int batchSize() {
    return batchSize;
  }

  public boolean deduplication() {
    return deduplication;
  }

  /** Builder for {@link ConnectorConfig}. */
  public static final class Builder {
    private String name;
    private boolean enabled = true;
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(5);
    private Duration timeout = Duration.ofSeconds(30);
    private int batchSize = 100;
    private boolean deduplication = true;

    private Builder() {
    }

    /** Display name used in logs. Optional. */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Extra attempts after the first one. Optional. Defaults to {@code 3}.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Delay before the first retry; doubles on each further retry. Optional. Defaults to {@code 5s}.
     */
    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    /** Per-attempt timeout. Optional. Defaults to {@code 30s}. */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Optional. Defaults to {@code 100}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Skip subjects already delivered by this connector type. Needs a {@link DeliveryTracker}.
     * Optional. Defaults to {@code true}.
     */
    public Builder deduplication(boolean deduplication) {
      this.deduplication = deduplication;
      return this;
    }

    public ConnectorConfig build() {
      return new ConnectorConfig(this);
    }
  }
}
