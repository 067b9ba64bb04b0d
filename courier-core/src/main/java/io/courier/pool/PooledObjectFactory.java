package io.courier.pool;

/**
 * Lifecycle callbacks used by {@link ResourcePool} to create, check and destroy the
 * objects it manages.
 *
 * @param <T> pooled object type
 */
public interface PooledObjectFactory<T> {

    /**
     * Creates a new live object. Called outside the pool lock; may block on the network.
     *
     * @return a new object (never {@code null})
     * @throws Exception if the object cannot be created; the pool retries per its policy
     */
    T create() throws Exception;

    /**
     * Checks whether an object may be lent out again.
     *
     * @param object the object to check
     * @return {@code true} if healthy
     */
    boolean isHealthy(T object);

    /**
     * Destroys an object. Implementations must not throw.
     *
     * @param object the object to destroy
     */
    void destroy(T object);
}
