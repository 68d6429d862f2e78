package jobflow.worker;

import jobflow.model.Job;

/**
 * Executes one operation type against a resolved subject.
 *
 * <p>Throwing any exception fails the attempt; the worker retries it with backoff
 * until the job's retry budget is spent. The returned value's {@code toString()} is
 * stored as the job result ({@code null} stores nothing).
 *
 * <p>A handler may be interrupted when it exceeds the job timeout and should
 * return promptly when that happens.
 *
 * @param <S> subject type, e.g. a document
 */
@FunctionalInterface
public interface JobHandler<S> {

  Object execute(Job job, S subject) throws Exception;
}
