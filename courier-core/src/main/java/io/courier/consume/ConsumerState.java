package io.courier.consume;

/**
 * Lifecycle states of an {@link EventConsumer}.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> BOUND -> CONSUMING
 *                     ^                      |
 *                     +--- ERROR_BACKOFF <---+   (any channel or connection error)
 * </pre>
 * {@link #STOPPED} is only reached through {@link EventConsumer#close()}.
 */
public enum ConsumerState {
  /** Created, not yet started. */
  DISCONNECTED,
  /** Acquiring a connection, opening a channel, declaring and binding the queue. */
  CONNECTING,
  /** Queue declared and bound; consumption not yet registered. */
  BOUND,
  /** Receiving deliveries. */
  CONSUMING,
  /** Waiting before the next connection attempt. */
  ERROR_BACKOFF,
  /** Closed by its owner; the consumer thread has exited. */
  STOPPED
}
