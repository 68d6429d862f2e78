/**
 * Job queue API: {@link jobflow.JobQueue}, {@link jobflow.JobRequest} and operation types.
 *
 * @see jobflow.worker.Worker
 */
package jobflow;
