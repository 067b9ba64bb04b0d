package io.courier;

import io.courier.broker.BrokerConnectionPoolFactory;
import io.courier.broker.Topology;
import io.courier.consume.EventConsumer;
import io.courier.consume.EventHandler;
import io.courier.consume.Subscription;
import io.courier.pool.ResourcePool;
import io.courier.publish.EventPublisher;
import io.courier.retry.RetryPolicy;
import io.courier.spi.BrokerConnection;
import io.courier.spi.BrokerConnectionFactory;
import io.courier.spi.MetricsExporter;
import io.courier.util.JsonCodec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a connection {@link ResourcePool}, an
 * {@link EventPublisher} and any number of {@link EventConsumer}s into a single
 * {@link AutoCloseable} unit sharing one broker configuration.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Courier courier = Courier.builder()
 *     .connectionFactory(RabbitBrokerConnectionFactory.builder().fromEnvironment(System.getenv()).build())
 *     .build()) {
 *   courier.subscribe("auth_service_user_events", List.of("user.*"), Topology.USER_EVENTS,
 *       payload -> handleUserEvent(payload));
 *   courier.start();
 *   courier.publish(Topology.USER_EVENTS, "user.registered", Map.of("user_id", 42));
 * }
 * }</pre>
 *
 * @see EventPublisher
 * @see EventConsumer
 */
public final class Courier implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Courier.class.getName());

  private final ResourcePool<BrokerConnection> pool;
  private final EventPublisher publisher;
  private final MetricsExporter metrics;
  private final JsonCodec codec;
  private final RetryPolicy reconnectPolicy;
  private final int prefetch;
  private final int maxDeliveryAttempts;
  private final long receiveTimeoutMs;
  private final List<EventConsumer> consumers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  private Courier(Builder builder) {
    Objects.requireNonNull(builder.connectionFactory, "connectionFactory");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.codec = builder.codec != null ? builder.codec : JsonCodec.getDefault();
    Topology topology = builder.topology != null ? builder.topology : Topology.defaults();

    ResourcePool.Builder<BrokerConnection> poolBuilder = ResourcePool
        .builder(new BrokerConnectionPoolFactory(builder.connectionFactory, topology))
        .name("courier-connections")
        .capacity(builder.poolCapacity)
        .maxIdle(builder.poolMaxIdle)
        .acquireTimeout(builder.acquireTimeout)
        .creationAttempts(builder.creationAttempts)
        .metrics(metrics);
    if (builder.creationRetryPolicy != null) {
      poolBuilder.creationRetryPolicy(builder.creationRetryPolicy);
    }
    this.pool = poolBuilder.build();

    this.publisher = EventPublisher.builder()
        .pool(pool)
        .codec(codec)
        .retryPolicy(builder.publishRetryPolicy)
        .metrics(metrics)
        .batchSize(builder.batchSize)
        .idleIntervalMs(builder.idleIntervalMs)
        .drainTimeoutMs(builder.drainTimeoutMs)
        .build();

    this.reconnectPolicy = builder.reconnectPolicy;
    this.prefetch = builder.prefetch;
    this.maxDeliveryAttempts = builder.maxDeliveryAttempts;
    this.receiveTimeoutMs = builder.receiveTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the publisher drain thread and every consumer registered so far. Consumers
   * registered afterwards start immediately. Subsequent calls are no-ops.
   */
  public void start() {
    if (closed.get()) {
      throw new IllegalStateException("Courier has been closed");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    publisher.start();
    for (EventConsumer consumer : consumers) {
      consumer.start();
    }
    logger.info("Courier started with " + consumers.size() + " consumer(s)");
  }

  /**
   * Queues an event for background delivery. See {@link EventPublisher#publish(String, String, Map)}.
   *
   * @return {@code true} if the event was queued
   */
  public boolean publish(String exchange, String routingKey, Map<String, ?> payload) {
    return publisher.publish(exchange, routingKey, payload);
  }

  /**
   * Registers a consumer for {@code queueName} bound to {@code exchange} under every key
   * in {@code routingKeys}.
   *
   * @return the consumer, already started if this courier is running
   */
  public EventConsumer subscribe(String queueName, Collection<String> routingKeys, String exchange,
      EventHandler handler) {
    return subscribe(Subscription.of(queueName, routingKeys, exchange, handler));
  }

  public EventConsumer subscribe(Subscription subscription) {
    if (closed.get()) {
      throw new IllegalStateException("Courier has been closed");
    }
    EventConsumer consumer = EventConsumer.builder()
        .pool(pool)
        .subscription(subscription)
        .codec(codec)
        .retryPolicy(reconnectPolicy)
        .metrics(metrics)
        .prefetch(prefetch)
        .maxDeliveryAttempts(maxDeliveryAttempts)
        .receiveTimeoutMs(receiveTimeoutMs)
        .build();
    consumers.add(consumer);
    if (started.get()) {
      consumer.start();
    }
    return consumer;
  }

  public EventPublisher publisher() {
    return publisher;
  }

  public ResourcePool<BrokerConnection> pool() {
    return pool;
  }

  public List<EventConsumer> consumers() {
    return new ArrayList<>(consumers);
  }

  /**
   * Shuts down components in order: consumers, publisher (draining its queue), pool.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    for (EventConsumer consumer : consumers) {
      try {
        consumer.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    try {
      publisher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      pool.closeAll();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Courier}. */
  public static final class Builder {
    private BrokerConnectionFactory connectionFactory;
    private Topology topology;
    private MetricsExporter metrics;
    private JsonCodec codec;
    private int poolCapacity = 20;
    private int poolMaxIdle = -1;
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private int creationAttempts = 5;
    private RetryPolicy creationRetryPolicy;
    private RetryPolicy publishRetryPolicy;
    private int batchSize = 50;
    private long idleIntervalMs = 100;
    private long drainTimeoutMs = 5000;
    private RetryPolicy reconnectPolicy;
    private int prefetch = 1;
    private int maxDeliveryAttempts = 0;
    private long receiveTimeoutMs = 1000;

    private Builder() {}

    /**
     * Sets the factory that opens broker connections.
     *
     * <p><b>Required.</b>
     *
     * @param connectionFactory the connection factory
     * @return this builder
     */
    public Builder connectionFactory(BrokerConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    /**
     * Sets the exchanges declared on every new connection.
     *
     * <p>Optional. Defaults to {@link Topology#defaults()}.
     *
     * @param topology the topology
     * @return this builder
     */
    public Builder topology(Topology topology) {
      this.topology = topology;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder codec(JsonCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the maximum number of broker connections.
     *
     * <p>Optional. Defaults to {@code 20}.
     *
     * @param poolCapacity pool capacity
     * @return this builder
     */
    public Builder poolCapacity(int poolCapacity) {
      this.poolCapacity = poolCapacity;
      return this;
    }

    public Builder poolMaxIdle(int poolMaxIdle) {
      this.poolMaxIdle = poolMaxIdle;
      return this;
    }

    public Builder acquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    /**
     * Sets how many times opening a connection is tried before giving up.
     *
     * <p>Optional. Defaults to {@code 5}.
     *
     * @param creationAttempts attempt count
     * @return this builder
     */
    public Builder creationAttempts(int creationAttempts) {
      this.creationAttempts = creationAttempts;
      return this;
    }

    public Builder creationRetryPolicy(RetryPolicy creationRetryPolicy) {
      this.creationRetryPolicy = creationRetryPolicy;
      return this;
    }

    public Builder publishRetryPolicy(RetryPolicy publishRetryPolicy) {
      this.publishRetryPolicy = publishRetryPolicy;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder idleIntervalMs(long idleIntervalMs) {
      this.idleIntervalMs = idleIntervalMs;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the wait between consumer reconnect attempts.
     *
     * <p>Optional. Defaults to a fixed 5 second delay.
     *
     * @param reconnectPolicy the retry policy
     * @return this builder
     */
    public Builder reconnectPolicy(RetryPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    public Builder prefetch(int prefetch) {
      this.prefetch = prefetch;
      return this;
    }

    public Builder maxDeliveryAttempts(int maxDeliveryAttempts) {
      this.maxDeliveryAttempts = maxDeliveryAttempts;
      return this;
    }

    public Builder receiveTimeoutMs(long receiveTimeoutMs) {
      this.receiveTimeoutMs = receiveTimeoutMs;
      return this;
    }

    public Courier build() {
      return new Courier(this);
    }
  }
}
