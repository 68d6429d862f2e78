package jobflow;

import com.github.f4b6a3.ulid.UlidCreator;
import jobflow.model.JobPriority;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a job to enqueue.
 *
 * <p>Each request is assigned a ULID-based {@code jobId} when built. The ID is only
 * used if the request is not deduplicated by its idempotency key.
 *
 * <pre>{@code
 * JobRequest request = JobRequest.builder("doc_123", "INVOICE_EXTRACTION")
 *     .priority(JobPriority.HIGH)
 *     .idempotencyKey("invoice_extraction:" + checksum)
 *     .build();
 * }</pre>
 *
 * @see JobQueue#enqueue(JobRequest)
 */
public final class JobRequest {
  public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

  private final String jobId;
  private final String subjectId;
  private final String operationType;
  private final String tenantId;
  private final JobPriority priority;
  private final List<String> dependsOn;
  private final Map<String, String> details;
  private final String idempotencyKey;
  private final Instant createdAt;

  private JobRequest(Builder builder) {
    this.jobId = builder.jobId == null ? newJobId() : builder.jobId;
    this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId");
    this.operationType = Objects.requireNonNull(builder.operationType, "operationType");
    if (operationType.isEmpty()) {
      throw new IllegalArgumentException("operationType cannot be empty");
    }
    this.tenantId = builder.tenantId;
    this.priority = builder.priority == null ? JobPriority.NORMAL : builder.priority;
    this.dependsOn = builder.dependsOn == null ? List.of() : List.copyOf(builder.dependsOn);
    Map<String, String> detailCopy = builder.details == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    if (detailCopy.containsKey(null) || detailCopy.containsValue(null)) {
      throw new IllegalArgumentException("details cannot contain null keys or values");
    }
    this.details = detailCopy;
    if (builder.idempotencyKey != null && builder.idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
      throw new IllegalArgumentException("idempotencyKey exceeds "
          + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
    }
    this.idempotencyKey = builder.idempotencyKey;
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
  }

  public static Builder builder(String subjectId, String operationType) {
    return new Builder(subjectId, operationType);
  }

  public static Builder builder(String subjectId, OperationType operationType) {
    return new Builder(subjectId, Objects.requireNonNull(operationType, "operationType").name());
  }

  static String newJobId() {
    return "job_" + UlidCreator.getMonotonicUlid().toString().toLowerCase();
  }

  public String jobId() {
    return jobId;
  }

  public String subjectId() {
    return subjectId;
  }

  public String operationType() {
    return operationType;
  }

  public String tenantId() {
    return tenantId;
  }

  public JobPriority priority() {
    return priority;
  }

  public List<String> dependsOn() {
    return dependsOn;
  }

  public Map<String, String> details() {
    return details;
  }

  public String idempotencyKey() {
    return idempotencyKey;
  }

  public Instant createdAt() {
    return createdAt;
  }

  /** Builder for {@link JobRequest}. */
  public static final class Builder {
    private String jobId;
    private final String subjectId;
    private final String operationType;
    private String tenantId;
    private JobPriority priority;
    private List<String> dependsOn;
    private Map<String, String> details;
    private String idempotencyKey;
    private Instant createdAt;

    private Builder(String subjectId, String operationType) {
      this.subjectId = subjectId;
      this.operationType = operationType;
    }

    /** Overrides the generated job ID. Mainly useful in tests. */
    public Builder jobId(String jobId) {
      this.jobId = jobId;
      return this;
    }

    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder priority(JobPriority priority) {
      this.priority = priority;
      return this;
    }

    /**
     * Sets the IDs of jobs that must complete before this one becomes eligible.
     * Cycles are not detected.
     *
     * <p>Only COMPLETED satisfies a dependency; an ID with no job row is treated as
     * satisfied. If a dependency ends CANCELLED, FAILED or DEAD_LETTER, this job stays
     * PENDING until that dependency is retried to completion or this job is cancelled.
     * Nothing reports the blocked job.
     */
    public Builder dependsOn(List<String> dependsOn) {
      this.dependsOn = dependsOn;
      return this;
    }

    public Builder dependsOn(String... dependsOn) {
      return dependsOn(List.of(dependsOn));
    }

    public Builder details(Map<String, String> details) {
      this.details = details;
      return this;
    }

    public Builder idempotencyKey(String idempotencyKey) {
      this.idempotencyKey = idempotencyKey;
      return this;
    }

    /** Overrides the enqueue timestamp. Mainly useful in tests. */
    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public JobRequest build() {
      return new JobRequest(this);
    }
  }
}
