package io.courier.retry;

/**
 * Strategy for computing the delay before the next attempt after a failure.
 *
 * <p>Used for broker connection creation, publisher batch backoff and consumer
 * reconnects. Tests inject near-zero delays.
 *
 * @see FixedDelayRetryPolicy
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of consecutive failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);

    /**
     * Returns a policy that always waits {@code delayMs}.
     *
     * @param delayMs fixed delay in milliseconds
     * @return a fixed-delay policy
     */
    static RetryPolicy fixed(long delayMs) {
        return new FixedDelayRetryPolicy(delayMs);
    }
}
