package io.courier.retry;

/**
 * Retry policy that waits the same delay after every failure, regardless of the
 * attempt count.
 */
public final class FixedDelayRetryPolicy implements RetryPolicy {
  private final long delayMs;

  /**
   * @param delayMs delay between attempts (milliseconds)
   */
  public FixedDelayRetryPolicy(long delayMs) {
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
    }
    this.delayMs = delayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    return attempts <= 0 ? 0L : delayMs;
  }

  public long delayMs() {
    return delayMs;
  }

  @Override
  public String toString() {
    return "FixedDelayRetryPolicy[" + delayMs + "ms]";
  }
}
