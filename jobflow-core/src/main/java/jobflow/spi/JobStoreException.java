package jobflow.spi;

/**
 * Unchecked exception thrown when a job store operation fails, usually wrapping
 * a {@link java.sql.SQLException}.
 */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message) {
    super(message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
