package jobflow.worker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void doublesFromBase() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(5_000, 300_000);

    assertEquals(5_000, policy.computeDelayMs(0));
    assertEquals(10_000, policy.computeDelayMs(1));
    assertEquals(20_000, policy.computeDelayMs(2));
    assertEquals(160_000, policy.computeDelayMs(5));
  }

  @Test
  void capsAtMaximum() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(5_000, 300_000);

    assertEquals(300_000, policy.computeDelayMs(6));
    assertEquals(300_000, policy.computeDelayMs(40));
    assertEquals(300_000, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void zeroBaseMeansNoDelay() {
    assertEquals(0, new ExponentialBackoffRetryPolicy(0, 0).computeDelayMs(3));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 50));
  }
}
