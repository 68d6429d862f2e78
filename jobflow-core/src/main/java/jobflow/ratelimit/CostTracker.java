package jobflow.ratelimit;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates model token usage and its cost.
 *
 * <p>Prices are per one million tokens, split into input and output. Models missing
 * from the price table cost nothing but their tokens are still counted.
 * Thread-safe.
 */
public final class CostTracker {
  private static final Logger logger = Logger.getLogger(CostTracker.class.getName());

  private static final double TOKENS_PER_PRICE_UNIT = 1_000_000.0;

  /** Built-in price table, USD per 1M tokens. */
  public static final Map<String, ModelPrice> DEFAULT_PRICES = defaultPrices();

  private final Map<String, ModelPrice> prices;
  private final Map<String, Usage> usageByModel = new HashMap<>();

  public CostTracker() {
    this(DEFAULT_PRICES);
  }

  public CostTracker(Map<String, ModelPrice> prices) {
    this.prices = Map.copyOf(Objects.requireNonNull(prices, "prices"));
  }

  private static Map<String, ModelPrice> defaultPrices() {
    Map<String, ModelPrice> prices = new LinkedHashMap<>();
    prices.put("gpt-4", new ModelPrice(30.0, 60.0));
    prices.put("gpt-4-turbo", new ModelPrice(10.0, 30.0));
    prices.put("gpt-3.5-turbo", new ModelPrice(0.5, 1.5));
    prices.put("claude-3-opus", new ModelPrice(15.0, 75.0));
    prices.put("claude-3-sonnet", new ModelPrice(3.0, 15.0));
    prices.put("claude-3-haiku", new ModelPrice(0.25, 1.25));
    prices.put("llama-3", new ModelPrice(0.0, 0.0));
    return Map.copyOf(prices);
  }

  /**
   * Returns the cost of the given usage without recording it.
   */
  public double estimateCost(String model, long inputTokens, long outputTokens) {
    ModelPrice price = prices.get(model);
    if (price == null) {
      return 0.0;
    }
    return inputTokens / TOKENS_PER_PRICE_UNIT * price.inputPerMillion()
        + outputTokens / TOKENS_PER_PRICE_UNIT * price.outputPerMillion();
  }

  /**
   * Records usage and returns its cost.
   */
  public double record(String model, long inputTokens, long outputTokens) {
    Objects.requireNonNull(model, "model");
    if (!prices.containsKey(model)) {
      logger.log(Level.FINE, "No price for model {0}, recording zero cost", model);
    }
    double cost = estimateCost(model, inputTokens, outputTokens);
    synchronized (usageByModel) {
      usageByModel.computeIfAbsent(model, ignored -> new Usage()).add(inputTokens, outputTokens, cost);
    }
    return cost;
  }

  public CostSummary getSummary() {
    Map<String, CostSummary.ModelCost> byModel = new TreeMap<>();
    double total = 0.0;
    synchronized (usageByModel) {
      for (Map.Entry<String, Usage> e : usageByModel.entrySet()) {
        Usage u = e.getValue();
        byModel.put(e.getKey(), new CostSummary.ModelCost(u.cost, u.inputTokens, u.outputTokens));
        total += u.cost;
      }
    }
    return new CostSummary(total, byModel);
  }

  public void reset() {
    synchronized (usageByModel) {
      usageByModel.clear();
    }
  }

  /**
   * Price of a model in USD per one million tokens.
   */
  public record ModelPrice(double inputPerMillion, double outputPerMillion) {
    public ModelPrice {
      if (inputPerMillion < 0 || outputPerMillion < 0) {
        throw new IllegalArgumentException("prices must be >= 0");
      }
    }
  }

  private static final class Usage {
    long inputTokens;
    long outputTokens;
    double cost;

    void add(long input, long output, double amount) {
      inputTokens += input;
      outputTokens += output;
      cost += amount;
    }
  }
}
