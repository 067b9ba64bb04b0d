package io.courier.pool;

/**
 * Thrown by {@link ResourcePool#acquire()} when every slot is checked out and none was
 * returned within the acquire timeout. Not retried by the pool; the caller decides.
 */
public final class PoolExhaustedException extends RuntimeException {
  private final int capacity;
  private final long waitedMs;

  public PoolExhaustedException(String poolName, int capacity, long waitedMs) {
    super("Pool '" + poolName + "' exhausted: capacity=" + capacity + ", waited " + waitedMs + "ms");
    this.capacity = capacity;
    this.waitedMs = waitedMs;
  }

  public int capacity() {
    return capacity;
  }

  public long waitedMs() {
    return waitedMs;
  }
}
