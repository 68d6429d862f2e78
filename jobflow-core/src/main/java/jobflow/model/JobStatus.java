package jobflow.model;

/**
 * Lifecycle states of a job.
 *
 * <p>PENDING → PROCESSING → COMPLETED, PENDING (retry), FAILED or DEAD_LETTER.
 * PENDING → CANCELLED via {@link jobflow.JobQueue#cancel}. COMPLETED, CANCELLED
 * and DEAD_LETTER are terminal; FAILED and DEAD_LETTER may be re-queued manually.
 */
public enum JobStatus {
  PENDING(0),
  PROCESSING(1),
  COMPLETED(2),
  FAILED(3),
  CANCELLED(4),
  DEAD_LETTER(5);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Returns the status stored under the given code.
   *
   * @throws IllegalArgumentException if no status has that code
   */
  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }

  /** A live job blocks reuse of its idempotency key. */
  public boolean isLive() {
    return this != CANCELLED && this != DEAD_LETTER;
  }
}
