package docbuild.queue;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubles the wait after every failed build, starting at {@code baseDelayMs}
 * and never exceeding {@code maxDelayMs}.
 *
 * <p>With a positive {@code jitter} the delay is spread uniformly over
 * {@code [delay * (1 - jitter), delay * (1 + jitter))}, still capped at
 * {@code maxDelayMs}, so entries that failed together do not retry together.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * Creates a policy with 25% jitter.
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 0.25);
  }

  /**
   * @param baseDelayMs delay after the first failure (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   * @param jitter      relative spread in {@code [0, 1)}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay = baseDelayMs;
    for (int i = 1; i < attempts && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    delay = Math.min(delay, maxDelayMs);
    if (jitter > 0.0) {
      double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
      delay = (long) (delay * factor);
    }
    return Math.min(maxDelayMs, Math.max(0L, delay));
  }
}
