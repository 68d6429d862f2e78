package jobflow.worker;

import java.time.Duration;

/**
 * Point-in-time view of a worker.
 *
 * @param running            whether the poll loop is active
 * @param activeJobs         jobs executing right now
 * @param processedCount     jobs completed since start
 * @param retriedCount       failed attempts re-queued since start
 * @param failedCount        jobs moved to FAILED or DEAD_LETTER since start
 * @param uptime             time since {@link Worker#start()}, zero if never started
 * @param handlersRegistered operation types with a handler
 */
public record WorkerStats(
    boolean running,
    int activeJobs,
    long processedCount,
    long retriedCount,
    long failedCount,
    Duration uptime,
    int handlersRegistered) {
}
