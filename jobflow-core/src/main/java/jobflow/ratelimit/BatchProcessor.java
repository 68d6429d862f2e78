package jobflow.ratelimit;

import java.util.List;

/**
 * Processes a batch of items in one call.
 *
 * @param <I> item type
 * @param <R> result type
 */
@FunctionalInterface
public interface BatchProcessor<I, R> {

  /**
   * Returns one result per item, in item order.
   */
  List<R> process(List<I> items) throws Exception;
}
