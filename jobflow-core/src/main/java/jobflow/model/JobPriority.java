package jobflow.model;

/**
 * Advisory job priority. Stored with the job but not used to order claiming.
 */
public enum JobPriority {
  LOW(0),
  NORMAL(1),
  HIGH(2),
  URGENT(3);

  private final int value;

  JobPriority(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  public static JobPriority fromValue(int value) {
    for (JobPriority priority : values()) {
      if (priority.value == value) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Unknown job priority: " + value);
  }
}
