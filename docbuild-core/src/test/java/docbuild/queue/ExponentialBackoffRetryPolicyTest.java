package docbuild.queue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstFailureWaitsAboutBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 100_000);

    long delay = policy.computeDelayMs(1);

    // 25% jitter
    assertTrue(delay >= 750 && delay < 1250, "got: " + delay);
  }

  @Test
  void delayDoublesWithoutJitter() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100_000, 0.0);

    assertEquals(100, policy.computeDelayMs(1));
    assertEquals(200, policy.computeDelayMs(2));
    assertEquals(400, policy.computeDelayMs(3));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int i = 0; i < 20; i++) {
      assertTrue(policy.computeDelayMs(10) <= 500);
    }
  }

  @Test
  void highAttemptCountsDoNotOverflow() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(60_000, 3_600_000, 0.0);

    assertEquals(3_600_000, policy.computeDelayMs(64));
    assertEquals(3_600_000, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10_000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 10));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 10));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 1000, 1.0));
  }

  @Test
  void immediatePolicyNeverWaits() {
    assertEquals(0L, RetryPolicy.IMMEDIATE.computeDelayMs(3));
  }
}
