package io.courier.pool;

import io.courier.retry.RetryPolicy;
import io.courier.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of live objects (typically broker connections) with lazy growth and
 * bounded-wait backpressure.
 *
 * <p>Every pooled object is in exactly one of three states: idle in the pool, checked
 * out to one caller, or destroyed. The number of live (idle plus checked-out) objects
 * never exceeds {@code capacity}.
 *
 * <p>{@link #acquire()} takes an idle object if one is available, otherwise creates a new
 * one while below capacity, otherwise waits up to the acquire timeout for a release and
 * then fails with {@link PoolExhaustedException}. Object creation runs outside the pool
 * lock and is retried according to the creation {@link RetryPolicy}.
 *
 * <p>Create instances via {@link #builder(PooledObjectFactory)}. This class is thread-safe.
 *
 * @param <T> pooled object type
 */
public final class ResourcePool<T> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ResourcePool.class.getName());

  private final String name;
  private final PooledObjectFactory<T> factory;
  private final int capacity;
  private final int maxIdle;
  private final long acquireTimeoutNanos;
  private final int creationAttempts;
  private final RetryPolicy creationRetryPolicy;
  private final MetricsExporter metrics;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition slotAvailable = lock.newCondition();
  private final Deque<T> idle = new ArrayDeque<>();
  private final Set<T> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());
  private int live;
  private boolean closed;

  private ResourcePool(Builder<T> builder) {
    this.factory = Objects.requireNonNull(builder.factory, "factory");
    this.name = Objects.requireNonNull(builder.name, "name");
    if (builder.capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    int maxIdle = builder.maxIdle < 0 ? builder.capacity : builder.maxIdle;
    if (maxIdle > builder.capacity) {
      throw new IllegalArgumentException("maxIdle must be <= capacity");
    }
    if (builder.acquireTimeout == null || builder.acquireTimeout.isNegative()) {
      throw new IllegalArgumentException("acquireTimeout must be >= 0");
    }
    if (builder.creationAttempts < 1) {
      throw new IllegalArgumentException("creationAttempts must be >= 1");
    }
    this.capacity = builder.capacity;
    this.maxIdle = maxIdle;
    this.acquireTimeoutNanos = builder.acquireTimeout.toNanos();
    this.creationAttempts = builder.creationAttempts;
    this.creationRetryPolicy = builder.creationRetryPolicy != null
        ? builder.creationRetryPolicy : RetryPolicy.fixed(2000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static <T> Builder<T> builder(PooledObjectFactory<T> factory) {
    return new Builder<>(factory);
  }

  /**
   * Lends an object to the caller. The caller must hand it back through
   * {@link #release(Object)} or {@link #invalidate(Object)}.
   *
   * @return a live object owned exclusively by the caller until released
   * @throws PoolExhaustedException if the pool stayed at capacity for the whole acquire timeout
   * @throws ResourceCreationException if a new object could not be created
   * @throws IllegalStateException if the pool is closed
   */
  public T acquire() {
    long deadline = System.nanoTime() + acquireTimeoutNanos;
    while (true) {
      T candidate = null;
      lock.lock();
      try {
        while (true) {
          if (closed) {
            throw new IllegalStateException("Pool '" + name + "' is closed");
          }
          candidate = idle.pollFirst();
          if (candidate != null) {
            checkedOut.add(candidate);
            break;
          }
          if (live < capacity) {
            live++;
            break;
          }
          long remaining = deadline - System.nanoTime();
          if (remaining <= 0L) {
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(acquireTimeoutNanos);
            throw new PoolExhaustedException(name, capacity, waitedMs);
          }
          try {
            slotAvailable.awaitNanos(remaining);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolExhaustedException(name, capacity,
                TimeUnit.NANOSECONDS.toMillis(acquireTimeoutNanos - remaining));
          }
        }
      } finally {
        lock.unlock();
      }

      if (candidate == null) {
        return createReserved();
      }
      if (factory.isHealthy(candidate)) {
        reportState();
        return candidate;
      }
      logger.fine(() -> "Discarding unhealthy idle object from pool '" + name + "'");
      lock.lock();
      try {
        checkedOut.remove(candidate);
      } finally {
        lock.unlock();
      }
      discard(candidate);
    }
  }

  /**
   * Returns a checked-out object. Healthy objects go back to the idle set unless it is
   * full or the pool is closed; all others are destroyed.
   *
   * @param object the object previously obtained from {@link #acquire()}
   * @throws IllegalArgumentException if the object is not checked out from this pool
   */
  public void release(T object) {
    Objects.requireNonNull(object, "object");
    boolean healthy = factory.isHealthy(object);
    boolean destroy;
    lock.lock();
    try {
      if (!checkedOut.remove(object)) {
        throw new IllegalArgumentException("Object is not checked out from pool '" + name + "'");
      }
      destroy = closed || !healthy || idle.size() >= maxIdle;
      if (destroy) {
        live--;
      } else {
        idle.addFirst(object);
      }
      slotAvailable.signal();
    } finally {
      lock.unlock();
    }
    if (destroy) {
      factory.destroy(object);
    }
    reportState();
  }

  /**
   * Destroys a checked-out object known to be broken and frees its slot.
   *
   * @param object the object previously obtained from {@link #acquire()}
   * @throws IllegalArgumentException if the object is not checked out from this pool
   */
  public void invalidate(T object) {
    Objects.requireNonNull(object, "object");
    lock.lock();
    try {
      if (!checkedOut.remove(object)) {
        throw new IllegalArgumentException("Object is not checked out from pool '" + name + "'");
      }
    } finally {
      lock.unlock();
    }
    discard(object);
  }

  /**
   * Destroys every idle object and closes the pool. Objects still checked out are
   * destroyed when they are released. Further {@link #acquire()} calls fail.
   */
  public void closeAll() {
    List<T> drained;
    lock.lock();
    try {
      closed = true;
      drained = new ArrayList<>(idle);
      idle.clear();
      live -= drained.size();
      slotAvailable.signalAll();
    } finally {
      lock.unlock();
    }
    for (T object : drained) {
      factory.destroy(object);
    }
    if (!drained.isEmpty()) {
      logger.info("Pool '" + name + "' closed, destroyed " + drained.size() + " idle object(s)");
    }
    reportState();
  }

  @Override
  public void close() {
    closeAll();
  }

  public String name() {
    return name;
  }

  public int capacity() {
    return capacity;
  }

  /** Number of live objects, idle or checked out. */
  public int liveCount() {
    lock.lock();
    try {
      return live;
    } finally {
      lock.unlock();
    }
  }

  public int idleCount() {
    lock.lock();
    try {
      return idle.size();
    } finally {
      lock.unlock();
    }
  }

  public int checkedOutCount() {
    lock.lock();
    try {
      return checkedOut.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  private T createReserved() {
    T created;
    try {
      created = createWithRetry();
    } catch (RuntimeException e) {
      releaseSlot();
      throw e;
    }
    boolean lateClose;
    lock.lock();
    try {
      lateClose = closed;
      if (lateClose) {
        live--;
      } else {
        checkedOut.add(created);
      }
    } finally {
      lock.unlock();
    }
    if (lateClose) {
      factory.destroy(created);
      throw new IllegalStateException("Pool '" + name + "' is closed");
    }
    reportState();
    return created;
  }

  private T createWithRetry() {
    Exception last = null;
    for (int attempt = 1; attempt <= creationAttempts; attempt++) {
      try {
        T created = factory.create();
        return Objects.requireNonNull(created, "factory returned null");
      } catch (Exception e) {
        last = e;
        logger.log(Level.WARNING, "Failed to create object for pool '" + name
            + "' (attempt " + attempt + "/" + creationAttempts + "): " + e.getMessage());
      }
      if (attempt < creationAttempts) {
        try {
          Thread.sleep(creationRetryPolicy.computeDelayMs(attempt));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new ResourceCreationException("Interrupted while creating object for pool '" + name + "'", last);
        }
      }
    }
    logger.log(Level.SEVERE, "Giving up creating object for pool '" + name
        + "' after " + creationAttempts + " attempts", last);
    throw new ResourceCreationException("Could not create object for pool '" + name
        + "' after " + creationAttempts + " attempts", last);
  }

  private void discard(T object) {
    factory.destroy(object);
    releaseSlot();
  }

  private void releaseSlot() {
    lock.lock();
    try {
      live--;
      slotAvailable.signal();
    } finally {
      lock.unlock();
    }
    reportState();
  }

  private void reportState() {
    int liveNow;
    int idleNow;
    lock.lock();
    try {
      liveNow = live;
      idleNow = idle.size();
    } finally {
      lock.unlock();
    }
    metrics.recordPoolState(liveNow, idleNow);
  }

  /** Builder for {@link ResourcePool}. */
  public static final class Builder<T> {
    private final PooledObjectFactory<T> factory;
    private String name = "courier";
    private int capacity = 20;
    private int maxIdle = -1;
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private int creationAttempts = 5;
    private RetryPolicy creationRetryPolicy;
    private MetricsExporter metrics;

    private Builder(PooledObjectFactory<T> factory) {
      this.factory = factory;
    }

    /**
     * Sets the pool name used in log messages and exceptions.
     *
     * <p>Optional. Defaults to {@code "courier"}.
     *
     * @param name the pool name
     * @return this builder
     */
    public Builder<T> name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the maximum number of live objects.
     *
     * <p>Optional. Defaults to {@code 20}. Must be &ge; 1.
     *
     * @param capacity maximum live objects
     * @return this builder
     */
    public Builder<T> capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    /**
     * Sets the maximum number of idle objects kept for reuse.
     *
     * <p>Optional. Defaults to {@code capacity}.
     *
     * @param maxIdle maximum idle objects
     * @return this builder
     */
    public Builder<T> maxIdle(int maxIdle) {
      this.maxIdle = maxIdle;
      return this;
    }

    /**
     * Sets how long {@link ResourcePool#acquire()} waits when the pool is at capacity.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param acquireTimeout bounded wait
     * @return this builder
     */
    public Builder<T> acquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    /**
     * Sets how many times creation is attempted before {@link ResourceCreationException}.
     *
     * <p>Optional. Defaults to {@code 5}.
     *
     * @param creationAttempts attempts per creation
     * @return this builder
     */
    public Builder<T> creationAttempts(int creationAttempts) {
      this.creationAttempts = creationAttempts;
      return this;
    }

    /**
     * Sets the backoff between creation attempts.
     *
     * <p>Optional. Defaults to a fixed 2 second delay.
     *
     * @param creationRetryPolicy the retry policy
     * @return this builder
     */
    public Builder<T> creationRetryPolicy(RetryPolicy creationRetryPolicy) {
      this.creationRetryPolicy = creationRetryPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter receiving live/idle counts.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder<T> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ResourcePool<T> build() {
      return new ResourcePool<>(this);
    }
  }
}
