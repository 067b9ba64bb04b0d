package io.courier.pool;

/**
 * Thrown by {@link ResourcePool#acquire()} when a new object could not be created
 * after the configured number of attempts. The cause is the last creation failure.
 */
public final class ResourceCreationException extends RuntimeException {
  public ResourceCreationException(String message, Throwable cause) {
    super(message, cause);
  }
}
