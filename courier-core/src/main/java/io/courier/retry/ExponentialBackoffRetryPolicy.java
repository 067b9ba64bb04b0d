package io.courier.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy doubling the delay after each consecutive failure.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
 * When jitter is enabled the capped delay is scaled by a random factor in [0.5, 1.5)
 * and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * Creates a policy with jitter enabled.
   *
   * @param baseDelayMs delay after the first failure (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, true);
  }

  /**
   * @param baseDelayMs delay after the first failure (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   * @param jitter      whether to randomize delays
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
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
    long delay = maxDelayMs;
    if (attempts < 63) {
      long factor = 1L << (attempts - 1);
      if (factor <= maxDelayMs / baseDelayMs) {
        delay = baseDelayMs * factor;
      }
    }
    if (!jitter) {
      return delay;
    }
    long jittered = (long) (delay * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, jittered);
  }
}
