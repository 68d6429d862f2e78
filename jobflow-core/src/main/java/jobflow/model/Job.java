package jobflow.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of a persisted job row.
 *
 * @param id             job ID ({@code job_} + ULID)
 * @param subjectId      reference to the subject the job operates on (e.g. a document)
 * @param operationType  operation type name used to select a handler
 * @param tenantId       tenant for rate limiting, may be {@code null}
 * @param status         current lifecycle status
 * @param priority       advisory priority
 * @param idempotencyKey caller-supplied deduplication key, may be {@code null}
 * @param retryCount     number of failed attempts that were re-queued
 * @param lastError      error message of the most recent failed attempt
 * @param retryAfter     earliest time the job may be claimed again, may be {@code null}
 * @param details        caller-supplied details (never {@code null})
 * @param error          terminal error message (FAILED / DEAD_LETTER)
 * @param result         string form of the handler result (COMPLETED)
 * @param createdAt      enqueue time
 * @param startedAt      time of the current claim, {@code null} unless PROCESSING
 * @param completedAt    time the job reached a terminal status
 */
public record Job(
    String id,
    String subjectId,
    String operationType,
    String tenantId,
    JobStatus status,
    JobPriority priority,
    String idempotencyKey,
    int retryCount,
    String lastError,
    Instant retryAfter,
    Map<String, String> details,
    String error,
    String result,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
  public Job {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
