package jobflow.ratelimit;

import java.util.Map;

/**
 * Accumulated cost, in total and per model.
 */
public record CostSummary(double totalCost, Map<String, ModelCost> byModel) {

  public CostSummary {
    byModel = Map.copyOf(byModel);
  }

  /**
   * Cost and token counts of one model.
   */
  public record ModelCost(double cost, long inputTokens, long outputTokens) {
  }
}
