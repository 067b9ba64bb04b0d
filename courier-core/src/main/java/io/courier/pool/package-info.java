/**
 * Generic bounded object pool.
 *
 * <p>{@link io.courier.pool.ResourcePool} is the single point of mutual exclusion for
 * broker connections: an object is lent to at most one caller at a time, and callers
 * that find the pool at capacity wait a bounded time before
 * {@link io.courier.pool.PoolExhaustedException}.
 */
package io.courier.pool;
