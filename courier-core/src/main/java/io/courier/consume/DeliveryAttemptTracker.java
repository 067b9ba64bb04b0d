package io.courier.consume;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts failed handling attempts per message id so a consumer can stop requeueing a
 * message that keeps failing.
 *
 * <p>Counts live in memory only and are forgotten after {@code ttlMs} without a new
 * failure, so a restart or a long pause resets them. This class is thread-safe.
 */
final class DeliveryAttemptTracker {
  private final Map<String, Attempts> attempts = new ConcurrentHashMap<>();
  private final long ttlMs;
  private final AtomicInteger evictCounter = new AtomicInteger();

  DeliveryAttemptTracker(long ttlMs) {
    if (ttlMs <= 0) {
      throw new IllegalArgumentException("ttlMs must be > 0");
    }
    this.ttlMs = ttlMs;
  }

  /**
   * Records a failed attempt.
   *
   * @return failures recorded for this message so far, including this one
   */
  int recordFailure(String messageId) {
    long now = System.currentTimeMillis();
    maybeEvictExpired(now);
    Attempts updated = attempts.compute(messageId, (id, current) -> {
      if (current == null || now - current.lastFailureAt > ttlMs) {
        return new Attempts(1, now);
      }
      return new Attempts(current.count + 1, now);
    });
    return updated.count;
  }

  void forget(String messageId) {
    attempts.remove(messageId);
  }

  int tracked() {
    return attempts.size();
  }

  private void maybeEvictExpired(long now) {
    // Sweep roughly every 256 failures
    if ((evictCounter.incrementAndGet() & 0xFF) != 0) return;
    attempts.entrySet().removeIf(e -> now - e.getValue().lastFailureAt > ttlMs);
  }

  private record Attempts(int count, long lastFailureAt) {
  }
}
