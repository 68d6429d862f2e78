package jobflow.worker;

import java.util.Optional;
import java.util.Set;

/**
 * Looks up the handler for an operation type.
 *
 * @param <S> subject type passed to handlers
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry<S> {

  /**
   * Returns the handler registered for the operation type, if any.
   */
  Optional<JobHandler<S>> handlerFor(String operationType);

  /**
   * Returns the operation types that currently have a handler.
   */
  Set<String> operationTypes();
}
