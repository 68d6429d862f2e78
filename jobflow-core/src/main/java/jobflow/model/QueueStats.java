package jobflow.model;

import java.util.Map;

/**
 * Aggregated job counts.
 *
 * @param total    number of job rows
 * @param byStatus row count per status (statuses with no rows are absent)
 * @param byType   row count per operation type
 */
public record QueueStats(int total, Map<JobStatus, Integer> byStatus, Map<String, Integer> byType) {

  public QueueStats {
    byStatus = Map.copyOf(byStatus);
    byType = Map.copyOf(byType);
  }

  public int count(JobStatus status) {
    return byStatus.getOrDefault(status, 0);
  }
}
