package io.courier.consume;

import io.courier.pool.PoolExhaustedException;
import io.courier.pool.ResourceCreationException;
import io.courier.pool.ResourcePool;
import io.courier.retry.RetryPolicy;
import io.courier.spi.BrokerChannel;
import io.courier.spi.BrokerConnection;
import io.courier.spi.Delivery;
import io.courier.spi.MetricsExporter;
import io.courier.util.JsonCodec;
import io.courier.util.NamedDaemonThreadFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-lived, self-healing consumer for one {@link Subscription}.
 *
 * <p>Runs on its own daemon thread and never shares its channel, so a slow handler only
 * delays its own queue. The thread cycles through {@link ConsumerState}: it borrows a
 * pooled connection, opens a channel, declares the durable queue, binds every routing
 * key, sets the prefetch limit and then pulls deliveries one at a time. Any channel,
 * connection or pool error hands the connection back (or discards it if broken), waits
 * per the {@link RetryPolicy} and starts over.
 *
 * <p>Each delivery is decoded and passed to the {@link EventHandler}. A normal return
 * acknowledges it; an exception (or an undecodable body) negatively acknowledges it with
 * requeue. When {@code maxDeliveryAttempts} is positive, a message that has failed that
 * many times is rejected without requeue instead, leaving it to the broker's
 * dead-letter configuration.
 *
 * <p>Create instances via {@link #builder()}. The consumer runs until {@link #close()}.
 */
public final class EventConsumer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventConsumer.class.getName());

  private final ResourcePool<BrokerConnection> pool;
  private final Subscription subscription;
  private final JsonCodec codec;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final int prefetch;
  private final int maxDeliveryAttempts;
  private final long receiveTimeoutMs;
  private final long shutdownTimeoutMs;
  private final DeliveryAttemptTracker attemptTracker;

  private final AtomicBoolean started = new AtomicBoolean();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final Object stateMonitor = new Object();
  private volatile boolean running = true;
  private volatile ConsumerState state = ConsumerState.DISCONNECTED;
  private volatile ExecutorService worker;

  private EventConsumer(Builder builder) {
    this.pool = Objects.requireNonNull(builder.pool, "pool");
    this.subscription = Objects.requireNonNull(builder.subscription, "subscription");
    this.codec = builder.codec != null ? builder.codec : JsonCodec.getDefault();
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.fixed(5000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.prefetch < 1) {
      throw new IllegalArgumentException("prefetch must be >= 1");
    }
    if (builder.maxDeliveryAttempts < 0) {
      throw new IllegalArgumentException("maxDeliveryAttempts must be >= 0");
    }
    if (builder.receiveTimeoutMs <= 0) {
      throw new IllegalArgumentException("receiveTimeoutMs must be > 0");
    }
    this.prefetch = builder.prefetch;
    this.maxDeliveryAttempts = builder.maxDeliveryAttempts;
    this.receiveTimeoutMs = builder.receiveTimeoutMs;
    this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
    this.attemptTracker = new DeliveryAttemptTracker(builder.attemptTtlMs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the consumer thread. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the consumer has been closed
   */
  public void start() {
    if (!running) {
      throw new IllegalStateException("EventConsumer has been closed");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    ExecutorService executor = Executors.newSingleThreadExecutor(
        new NamedDaemonThreadFactory("courier-consumer-" + subscription.queueName() + "-"));
    worker = executor;
    executor.submit(this::run);
  }

  public Subscription subscription() {
    return subscription;
  }

  public ConsumerState state() {
    return state;
  }

  /**
   * Waits until the consumer reaches {@code expected}.
   *
   * @return {@code true} if the state was reached before the timeout
   */
  public boolean awaitState(ConsumerState expected, long timeout, TimeUnit unit) throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    synchronized (stateMonitor) {
      while (state != expected) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          return false;
        }
        stateMonitor.wait(remainingMs);
      }
      return true;
    }
  }

  private void transition(ConsumerState next) {
    synchronized (stateMonitor) {
      state = next;
      stateMonitor.notifyAll();
    }
  }

  private void run() {
    int consecutiveFailures = 0;
    while (running) {
      transition(ConsumerState.CONNECTING);
      BrokerConnection connection = null;
      BrokerChannel channel = null;
      boolean broken = false;
      try {
        connection = pool.acquire();
        channel = connection.openChannel();
        bind(channel);
        transition(ConsumerState.BOUND);

        channel.setPrefetch(prefetch);
        channel.startConsuming(subscription.queueName());
        transition(ConsumerState.CONSUMING);
        consecutiveFailures = 0;
        logger.info("Consuming from " + subscription.queueName() + " bound to " + subscription.exchange()
            + " " + subscription.routingKeys());

        while (running) {
          Delivery delivery = channel.nextDelivery(receiveTimeoutMs);
          if (delivery != null) {
            handleDelivery(channel, delivery);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (PoolExhaustedException | ResourceCreationException e) {
        if (running) {
          logger.log(Level.WARNING, "No broker connection for " + subscription.queueName() + ": " + e.getMessage());
        }
      } catch (IOException e) {
        broken = true;
        if (running) {
          logger.log(Level.WARNING, "Broker connection error on " + subscription.queueName() + ": " + e.getMessage());
        }
      } catch (RuntimeException | Error e) {
        if (running) {
          logger.log(Level.SEVERE, "Unexpected error in consumer for " + subscription.queueName(), e);
        }
      } finally {
        if (channel != null) {
          channel.close();
        }
        if (connection != null) {
          returnConnection(connection, broken);
        }
      }

      if (running) {
        transition(ConsumerState.ERROR_BACKOFF);
        metrics.incrementConsumerReconnect();
        consecutiveFailures++;
        long delayMs = retryPolicy.computeDelayMs(consecutiveFailures);
        try {
          stopSignal.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
    transition(ConsumerState.STOPPED);
    logger.info("Consumer for " + subscription.queueName() + " stopped");
  }

  private void bind(BrokerChannel channel) throws IOException {
    channel.declareQueue(subscription.queueName(), true);
    for (String routingKey : subscription.routingKeys()) {
      channel.bindQueue(subscription.queueName(), subscription.exchange(), routingKey);
    }
  }

  private void returnConnection(BrokerConnection connection, boolean broken) {
    try {
      if (broken && !connection.isOpen()) {
        pool.invalidate(connection);
      } else {
        pool.release(connection);
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to return connection to pool", e);
    }
  }

  void handleDelivery(BrokerChannel channel, Delivery delivery) throws IOException {
    Throwable failure;
    try {
      Map<String, Object> payload = codec.decode(delivery.body());
      subscription.handler().handle(payload);
      failure = null;
    } catch (Throwable t) {
      failure = t;
    }

    String messageId = delivery.messageId();
    if (failure == null) {
      channel.ack(delivery.deliveryTag());
      metrics.incrementDeliveryAcked();
      if (messageId != null) {
        attemptTracker.forget(messageId);
      }
      return;
    }

    if (maxDeliveryAttempts > 0 && messageId != null
        && attemptTracker.recordFailure(messageId) >= maxDeliveryAttempts) {
      attemptTracker.forget(messageId);
      channel.nack(delivery.deliveryTag(), false);
      metrics.incrementDeliveryRejected();
      logger.log(Level.SEVERE, "Rejecting message " + messageId + " from " + subscription.queueName()
          + " after " + maxDeliveryAttempts + " failed attempts", failure);
      return;
    }
    channel.nack(delivery.deliveryTag(), true);
    metrics.incrementDeliveryRequeued();
    logger.log(Level.WARNING, "Error processing message from " + subscription.queueName()
        + ", requeued: " + failure);
    // the message is back on the queue; let the loop drop this channel and reconnect
    if (failure instanceof VirtualMachineError vmError) {
      throw vmError;
    }
  }

  /**
   * Stops the consumer: the current delivery (if any) is finished, the channel is closed
   * and the connection handed back to the pool. Waits up to the shutdown timeout for the
   * thread to exit, then interrupts it.
   */
  @Override
  public void close() {
    if (!running) {
      return;
    }
    running = false;
    stopSignal.countDown();
    ExecutorService executor = worker;
    if (executor == null) {
      transition(ConsumerState.STOPPED);
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Consumer for " + subscription.queueName() + " did not stop in time; interrupting");
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventConsumer}. */
  public static final class Builder {
    private ResourcePool<BrokerConnection> pool;
    private Subscription subscription;
    private JsonCodec codec;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private int prefetch = 1;
    private int maxDeliveryAttempts = 0;
    private long receiveTimeoutMs = 1000;
    private long shutdownTimeoutMs = 5000;
    private long attemptTtlMs = 3_600_000;

    private Builder() {}

    /**
     * Sets the connection pool.
     *
     * <p><b>Required.</b>
     *
     * @param pool the broker connection pool
     * @return this builder
     */
    public Builder pool(ResourcePool<BrokerConnection> pool) {
      this.pool = pool;
      return this;
    }

    /**
     * Sets the queue, bindings and handler.
     *
     * <p><b>Required.</b>
     *
     * @param subscription the subscription
     * @return this builder
     */
    public Builder subscription(Subscription subscription) {
      this.subscription = subscription;
      return this;
    }

    public Builder codec(JsonCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the wait between reconnect attempts.
     *
     * <p>Optional. Defaults to a fixed 5 second delay.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the maximum number of unacknowledged deliveries held at once.
     *
     * <p>Optional. Defaults to {@code 1}.
     *
     * @param prefetch prefetch count
     * @return this builder
     */
    public Builder prefetch(int prefetch) {
      this.prefetch = prefetch;
      return this;
    }

    /**
     * Sets how many failed attempts a message gets before it is rejected without requeue.
     *
     * <p>Optional. Defaults to {@code 0}, meaning failed messages are always requeued.
     *
     * @param maxDeliveryAttempts attempt cap, or 0 for unlimited
     * @return this builder
     */
    public Builder maxDeliveryAttempts(int maxDeliveryAttempts) {
      this.maxDeliveryAttempts = maxDeliveryAttempts;
      return this;
    }

    /**
     * Sets how long one receive call blocks before the loop checks for shutdown.
     *
     * <p>Optional. Defaults to {@code 1000} ms.
     *
     * @param receiveTimeoutMs receive timeout in milliseconds
     * @return this builder
     */
    public Builder receiveTimeoutMs(long receiveTimeoutMs) {
      this.receiveTimeoutMs = receiveTimeoutMs;
      return this;
    }

    /**
     * Sets how long {@link EventConsumer#close()} waits for the thread to exit.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param shutdownTimeoutMs shutdown timeout in milliseconds
     * @return this builder
     */
    public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
      this.shutdownTimeoutMs = shutdownTimeoutMs;
      return this;
    }

    /**
     * Sets how long failure counts are remembered without a new failure.
     *
     * <p>Optional. Defaults to one hour.
     *
     * @param attemptTtlMs time-to-live in milliseconds
     * @return this builder
     */
    public Builder attemptTtlMs(long attemptTtlMs) {
      this.attemptTtlMs = attemptTtlMs;
      return this;
    }

    public EventConsumer build() {
      return new EventConsumer(this);
    }
  }
}
