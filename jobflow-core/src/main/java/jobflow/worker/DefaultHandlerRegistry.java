package jobflow.worker;

import jobflow.OperationType;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe handler registry with one handler per operation type.
 *
 * <pre>{@code
 * DefaultHandlerRegistry<Document> registry = new DefaultHandlerRegistry<Document>()
 *     .register(DocumentOps.INVOICE_EXTRACTION, (job, doc) -> extractor.extract(doc))
 *     .register("INVOICE_VALIDATION", (job, doc) -> validator.validate(doc));
 * }</pre>
 *
 * <p>Registering a second handler for the same type replaces the first.
 */
public final class DefaultHandlerRegistry<S> implements HandlerRegistry<S> {
  private final ConcurrentMap<String, JobHandler<S>> handlers = new ConcurrentHashMap<>();

  public DefaultHandlerRegistry<S> register(OperationType operationType, JobHandler<S> handler) {
    return register(Objects.requireNonNull(operationType, "operationType").name(), handler);
  }

  public DefaultHandlerRegistry<S> register(String operationType, JobHandler<S> handler) {
    Objects.requireNonNull(operationType, "operationType");
    Objects.requireNonNull(handler, "handler");
    handlers.put(operationType, handler);
    return this;
  }

  /**
   * Removes the handler for the operation type.
   *
   * @return {@code true} if a handler was removed
   */
  public boolean unregister(String operationType) {
    return handlers.remove(operationType) != null;
  }

  @Override
  public Optional<JobHandler<S>> handlerFor(String operationType) {
    return Optional.ofNullable(handlers.get(operationType));
  }

  @Override
  public Set<String> operationTypes() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(handlers.keySet()));
  }
}
