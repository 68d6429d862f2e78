package jobflow.spi;

import jobflow.JobRequest;
import jobflow.model.Job;
import jobflow.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for jobs and their dependency edges.
 *
 * <p>Lifecycle: PENDING → PROCESSING → COMPLETED, PENDING (retry), FAILED or DEAD_LETTER.
 * PENDING jobs may also be CANCELLED; FAILED and DEAD_LETTER jobs may be reset to PENDING.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Status-changing methods are conditional on the current
 * status and return the number of rows updated, so a concurrent transition shows
 * up as {@code 0}. Transitions out of PROCESSING are also fenced on the claim's
 * {@code started_at}: an attempt whose claim was recovered as stale and claimed
 * again cannot overwrite the newer attempt's outcome. Implementations live in the {@code jobflow-jdbc} module and
 * throw {@link JobStoreException} on database errors.
 *
 * @see jobflow.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

    /**
     * Inserts a new job with status PENDING, retry count 0.
     *
     * @param conn    the JDBC connection (typically within a transaction)
     * @param request the job to persist; its {@code jobId} becomes the row ID
     */
    void insert(Connection conn, JobRequest request);

    /**
     * Inserts one dependency edge per entry: {@code jobId} waits for each of {@code dependsOn}.
     *
     * @param conn      the JDBC connection (typically within a transaction)
     * @param jobId     the dependent job
     * @param dependsOn IDs of the jobs it waits for
     */
    void insertDependencies(Connection conn, String jobId, Collection<String> dependsOn);

    Optional<Job> findById(Connection conn, String jobId);

    /**
     * Finds a job with the given idempotency key that is neither CANCELLED nor DEAD_LETTER.
     *
     * @param conn           the JDBC connection
     * @param idempotencyKey the key to look up
     * @return the live job, if any
     */
    Optional<Job> findLiveByIdempotencyKey(Connection conn, String idempotencyKey);

    /**
     * Returns the IDs of the jobs the given job depends on.
     */
    List<String> findDependencies(Connection conn, String jobId);

    /**
     * Selects PENDING jobs eligible to run, without claiming them.
     *
     * <p>A job is eligible when its {@code retry_after} is unset or not after {@code now}
     * and every job it depends on is COMPLETED or no longer exists. A dependency in any
     * other status, terminal or not, keeps the job out.
     *
     * @param conn           the JDBC connection
     * @param operationTypes operation types to consider; empty means none
     * @param now            current timestamp
     * @param limit          maximum number of jobs to return
     * @return eligible jobs, oldest first
     */
    List<Job> pollPending(Connection conn, Collection<String> operationTypes, Instant now, int limit);

    /**
     * Atomically moves a PENDING job to PROCESSING and stamps {@code started_at}.
     *
     * <p>Exactly one of any number of concurrent callers for the same job receives the job.
     *
     * @param conn      the JDBC connection
     * @param jobId     the job to claim
     * @param startedAt claim timestamp
     * @return the claimed job, or empty if the job was not PENDING
     */
    Optional<Job> claim(Connection conn, String jobId, Instant startedAt);

    /**
     * PROCESSING → COMPLETED.
     *
     * @param claimedAt the {@code startedAt} of the claimed job; the row must still carry it
     * @return the number of rows updated (0 or 1)
     */
    int markCompleted(Connection conn, String jobId, Instant claimedAt, String result, Instant completedAt);

    /**
     * PROCESSING → FAILED, without retry.
     *
     * @param claimedAt the {@code startedAt} of the claimed job; the row must still carry it
     * @return the number of rows updated (0 or 1)
     */
    int markFailed(Connection conn, String jobId, Instant claimedAt, String error, Instant completedAt);

    /**
     * PROCESSING → PENDING for another attempt.
     *
     * <p>Implementations <strong>must</strong> increment {@code retry_count}, record
     * {@code error} as the last error, set {@code retry_after} and clear {@code started_at}.
     *
     * @param claimedAt the {@code startedAt} of the claimed job; the row must still carry it
     * @return the number of rows updated (0 or 1)
     */
    int markRetry(Connection conn, String jobId, Instant claimedAt, Instant retryAfter, String error);

    /**
     * PROCESSING → DEAD_LETTER.
     *
     * @param claimedAt the {@code startedAt} of the claimed job; the row must still carry it
     * @return the number of rows updated (0 or 1)
     */
    int markDeadLetter(Connection conn, String jobId, Instant claimedAt, String error, Instant completedAt);

    /**
     * PENDING → CANCELLED.
     *
     * @return the number of rows updated (0 or 1)
     */
    int cancel(Connection conn, String jobId, Instant completedAt);

    /**
     * FAILED or DEAD_LETTER → PENDING. Clears {@code error}, {@code completed_at}
     * and {@code retry_after}.
     *
     * @param resetRetryCount whether {@code retry_count} goes back to 0
     * @return the number of rows updated (0 or 1)
     */
    int resetForRetry(Connection conn, String jobId, boolean resetRetryCount);

    /**
     * Moves PROCESSING jobs claimed before {@code cutoff} whose {@code retry_count} has
     * reached {@code maxRetries} to DEAD_LETTER with the given error.
     *
     * <p>Call before {@link #requeueStale} so the stale attempt counts against the limit.
     *
     * @return the number of jobs dead-lettered
     */
    int deadLetterStale(Connection conn, Instant cutoff, int maxRetries, String error, Instant completedAt);

    /**
     * Returns PROCESSING jobs claimed before {@code cutoff} to PENDING. The lost attempt
     * counts as a failure: {@code retry_count} is incremented and {@code error} recorded
     * as the last error.
     *
     * @return the number of jobs requeued
     */
    int requeueStale(Connection conn, Instant cutoff, String error);

    /**
     * Queries jobs in the given status.
     *
     * <p>DEAD_LETTER, COMPLETED, FAILED and CANCELLED jobs come back most recently
     * completed first; other statuses oldest first.
     *
     * @param operationType optional operation type filter ({@code null} for all)
     */
    List<Job> queryByStatus(Connection conn, JobStatus status, String operationType, int limit);

    /**
     * Counts jobs grouped by status and operation type.
     *
     * @return status → (operation type → count)
     */
    Map<JobStatus, Map<String, Integer>> countByStatusAndType(Connection conn);

    /**
     * Deletes up to {@code limit} COMPLETED jobs whose {@code completed_at} is before
     * {@code cutoff}. Their dependency edges go with them.
     *
     * @return the number of jobs deleted
     */
    int deleteCompletedBefore(Connection conn, Instant cutoff, int limit);

    /**
     * Checks whether a COMPLETED job exists for the subject and operation type.
     */
    boolean existsCompleted(Connection conn, String subjectId, String operationType);

    /**
     * Returns jobs for the subject whose operation type starts with {@code typePrefix},
     * newest first.
     */
    List<Job> queryBySubject(Connection conn, String subjectId, String typePrefix, int limit);
}
