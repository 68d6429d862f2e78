package jobflow.ratelimit;

/**
 * Thrown to each caller of {@link BatchAggregator#add} when the batch its item
 * belonged to failed.
 */
public class BatchProcessingException extends RuntimeException {

  public BatchProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
