package jobflow.worker;

import java.util.Optional;

/**
 * Loads the subject a job operates on.
 *
 * <p>An empty result fails the job terminally. A thrown exception counts as a
 * failed attempt and is retried.
 *
 * @param <S> subject type
 */
@FunctionalInterface
public interface SubjectResolver<S> {

  Optional<S> resolve(String subjectId) throws Exception;

  /**
   * Resolver that passes the subject ID through, for handlers that load their own data.
   */
  static SubjectResolver<String> ids() {
    return Optional::of;
  }
}
