package docbuild.queue;

/**
 * Strategy for computing how long a failed queue entry waits before it can be
 * claimed again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts failed attempts so far, including the one just recorded (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);

    /** Makes failed entries eligible again immediately. */
    RetryPolicy IMMEDIATE = attempts -> 0L;
}
