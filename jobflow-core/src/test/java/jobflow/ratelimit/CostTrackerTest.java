package jobflow.ratelimit;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CostTrackerTest {
  private static final double EPSILON = 1e-9;

  @Test
  void estimatesFromPerMillionPrices() {
    CostTracker tracker = new CostTracker();

    assertEquals(0.06, tracker.estimateCost("gpt-4", 1_000, 500), EPSILON);
    assertEquals(90.0, tracker.estimateCost("claude-3-opus", 1_000_000, 1_000_000), EPSILON);
    assertEquals(0.0, tracker.estimateCost("llama-3", 5_000_000, 5_000_000), EPSILON);
  }

  @Test
  void unknownModelCostsNothingButCountsTokens() {
    CostTracker tracker = new CostTracker();

    assertEquals(0.0, tracker.record("homegrown-7b", 100, 50), EPSILON);

    CostSummary.ModelCost usage = tracker.getSummary().byModel().get("homegrown-7b");
    assertEquals(100, usage.inputTokens());
    assertEquals(50, usage.outputTokens());
  }

  @Test
  void summaryAccumulatesPerModel() {
    CostTracker tracker = new CostTracker();
    tracker.record("gpt-3.5-turbo", 2_000_000, 0);
    tracker.record("gpt-3.5-turbo", 0, 1_000_000);
    tracker.record("claude-3-haiku", 4_000_000, 0);

    CostSummary summary = tracker.getSummary();

    assertEquals(1.0 + 1.5 + 1.0, summary.totalCost(), EPSILON);
    assertEquals(2.5, summary.byModel().get("gpt-3.5-turbo").cost(), EPSILON);
    assertEquals(2_000_000, summary.byModel().get("gpt-3.5-turbo").inputTokens());
  }

  @Test
  void resetClearsUsage() {
    CostTracker tracker = new CostTracker();
    tracker.record("gpt-4", 10, 10);

    tracker.reset();

    assertEquals(0.0, tracker.getSummary().totalCost(), EPSILON);
    assertTrue(tracker.getSummary().byModel().isEmpty());
  }

  @Test
  void customPriceTable() {
    CostTracker tracker = new CostTracker(Map.of("in-house", new CostTracker.ModelPrice(2.0, 4.0)));

    assertEquals(3.0, tracker.estimateCost("in-house", 500_000, 500_000), EPSILON);
    assertEquals(0.0, tracker.estimateCost("gpt-4", 1_000_000, 0), EPSILON);
  }

  @Test
  void rejectsNegativePrices() {
    assertThrows(IllegalArgumentException.class, () -> new CostTracker.ModelPrice(-1.0, 0.0));
  }
}
