package io.courier.publish;

import io.courier.Event;
import io.courier.pool.PoolExhaustedException;
import io.courier.pool.ResourceCreationException;
import io.courier.pool.ResourcePool;
import io.courier.retry.ExponentialBackoffRetryPolicy;
import io.courier.retry.RetryPolicy;
import io.courier.spi.BrokerChannel;
import io.courier.spi.BrokerConnection;
import io.courier.spi.MetricsExporter;
import io.courier.spi.OutboundMessage;
import io.courier.util.JsonCodec;
import io.courier.util.NamedDaemonThreadFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fire-and-forget publisher that queues events in memory and sends them to the broker in
 * batches from a single background thread.
 *
 * <p>{@link #publish(String, String, Map)} never touches the network: it fills in the
 * {@code timestamp}/{@code trace_id}/{@code event_type} defaults, appends the event to an
 * unbounded FIFO queue and returns. The drain thread started by {@link #start()} takes up
 * to {@code batchSize} events at a time, borrows one pooled connection, opens a channel
 * and publishes the batch in queue order with persistent delivery.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>a failed publish of one event is logged and counted; the event is not retried</li>
 *   <li>if no connection or channel can be obtained, the whole batch goes back to the
 *       tail of the queue and the drain thread backs off per the {@link RetryPolicy}</li>
 *   <li>if the broker closes the channel mid-batch, the failed event and everything after
 *       it go back to the tail of the queue the same way</li>
 * </ul>
 * Delivery is best-effort: no broker confirmation is awaited, and events still queued
 * when the process stops are lost.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; any number of
 * threads may publish concurrently.
 */
public final class EventPublisher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventPublisher.class.getName());

  private final ResourcePool<BrokerConnection> pool;
  private final JsonCodec codec;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int batchSize;
  private final long idleIntervalMs;
  private final long drainTimeoutMs;

  private final BlockingQueue<Event> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private volatile boolean running = true;
  private volatile ExecutorService worker;
  private int consecutiveFailures;
  private boolean drainAbandoned;

  private EventPublisher(Builder builder) {
    this.pool = Objects.requireNonNull(builder.pool, "pool");
    this.codec = builder.codec != null ? builder.codec : JsonCodec.getDefault();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(500, 30_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (builder.idleIntervalMs <= 0) {
      throw new IllegalArgumentException("idleIntervalMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.batchSize = builder.batchSize;
    this.idleIntervalMs = builder.idleIntervalMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the drain thread. Subsequent calls are no-ops, so at most one drain thread
   * ever runs for this publisher.
   *
   * @throws IllegalStateException if the publisher has been closed
   */
  public void start() {
    if (!accepting.get()) {
      throw new IllegalStateException("EventPublisher has been closed");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    ExecutorService executor = Executors.newSingleThreadExecutor(
        new NamedDaemonThreadFactory("courier-publisher-"));
    worker = executor;
    executor.submit(this::drainLoop);
    logger.info("Event publisher started (batchSize=" + batchSize + ")");
  }

  /**
   * Accepts an event for asynchronous delivery. Never blocks on the network.
   *
   * @param exchange   target exchange
   * @param routingKey routing key
   * @param payload    JSON-serializable payload; copied, never mutated
   * @return {@code true} once the event is queued; {@code false} if the publisher is closed
   */
  public boolean publish(String exchange, String routingKey, Map<String, ?> payload) {
    return enqueue(Event.of(exchange, routingKey, payload));
  }

  /**
   * Accepts a pre-built event for asynchronous delivery.
   *
   * @param event the event
   * @return {@code true} once queued; {@code false} if the publisher is closed
   */
  public boolean publish(Event event) {
    return enqueue(Objects.requireNonNull(event, "event"));
  }

  private boolean enqueue(Event event) {
    if (!accepting.get()) {
      logger.warning("Publisher closed, rejecting " + event);
      return false;
    }
    boolean accepted = queue.offer(event.withDefaults(clock));
    if (accepted) {
      metrics.incrementPublishAccepted();
      metrics.recordOutboundQueueDepth(queue.size());
    }
    return accepted;
  }

  /** Number of events accepted but not yet picked up by the drain thread. */
  public int pendingCount() {
    return queue.size();
  }

  public boolean isStarted() {
    return started.get();
  }

  private void drainLoop() {
    while (true) {
      try {
        if (!running && (queue.isEmpty() || drainAbandoned)) {
          break;
        }
        List<Event> batch = nextBatch();
        if (batch.isEmpty()) {
          if (!running) {
            break;
          }
          continue;
        }
        publishBatch(batch);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Publisher loop error", t);
      }
    }
    int dropped = queue.size();
    if (dropped > 0) {
      logger.severe("Publisher stopped with " + dropped + " undelivered event(s)");
    }
  }

  private List<Event> nextBatch() throws InterruptedException {
    List<Event> batch = new ArrayList<>(batchSize);
    Event first = queue.poll(idleIntervalMs, TimeUnit.MILLISECONDS);
    if (first == null) {
      return batch;
    }
    batch.add(first);
    queue.drainTo(batch, batchSize - 1);
    metrics.recordOutboundQueueDepth(queue.size());
    return batch;
  }

  void publishBatch(List<Event> batch) throws InterruptedException {
    BrokerConnection connection;
    try {
      connection = pool.acquire();
    } catch (PoolExhaustedException | ResourceCreationException | IllegalStateException e) {
      requeue(batch, e);
      return;
    }

    BrokerChannel channel;
    try {
      channel = connection.openChannel();
    } catch (IOException | RuntimeException e) {
      pool.invalidate(connection);
      requeue(batch, e);
      return;
    }

    int failures = 0;
    List<Event> unsent = List.of();
    Exception channelFailure = null;
    try {
      for (int i = 0; i < batch.size(); i++) {
        Event event = batch.get(i);
        try {
          publishOne(channel, event);
        } catch (IOException | RuntimeException e) {
          if (!channel.isOpen()) {
            // the broker closed the channel; this event and the rest never reached it
            unsent = new ArrayList<>(batch.subList(i, batch.size()));
            channelFailure = e;
            break;
          }
          failures++;
          metrics.incrementPublishFailure();
          logger.log(Level.SEVERE, "Failed to publish " + event + ", dropping it", e);
        }
      }
    } finally {
      channel.close();
      pool.release(connection);
    }
    if (!unsent.isEmpty()) {
      logger.warning("Channel closed after " + (batch.size() - unsent.size()) + " of "
          + batch.size() + " event(s) in batch");
      requeue(unsent, channelFailure);
      return;
    }
    consecutiveFailures = 0;
    if (failures > 0) {
      logger.warning("Published batch of " + batch.size() + " with " + failures + " failure(s)");
    } else {
      logger.fine(() -> "Published batch of " + batch.size());
    }
  }

  private void publishOne(BrokerChannel channel, Event event) throws IOException {
    byte[] body = codec.encode(event.payload());
    channel.publish(new OutboundMessage(event.exchange(), event.routingKey(), body,
        event.messageId(), Instant.now(clock), true));
    metrics.incrementPublishSuccess();
    logger.fine(() -> "Published " + event);
  }

  private void requeue(List<Event> batch, Exception cause) throws InterruptedException {
    queue.addAll(batch);
    metrics.incrementBatchRequeued();
    metrics.recordOutboundQueueDepth(queue.size());
    consecutiveFailures++;
    long delayMs = retryPolicy.computeDelayMs(consecutiveFailures);
    logger.log(Level.WARNING, "Could not publish batch of " + batch.size()
        + ", requeued; retrying in " + delayMs + "ms: " + cause.getMessage());
    if (running) {
      stopSignal.await(delayMs, TimeUnit.MILLISECONDS);
    } else {
      drainAbandoned = true;
    }
  }

  /**
   * Stops accepting events, gives the drain thread up to the drain timeout to flush the
   * queue, then stops it. Events still queued afterwards are dropped and logged.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    running = false;
    stopSignal.countDown();
    ExecutorService executor = worker;
    if (executor == null) {
      if (!queue.isEmpty()) {
        logger.severe("Publisher closed before start with " + queue.size() + " undelivered event(s)");
      }
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Drain timeout exceeded; forcing publisher shutdown with "
            + queue.size() + " event(s) queued");
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventPublisher}. */
  public static final class Builder {
    private ResourcePool<BrokerConnection> pool;
    private JsonCodec codec;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private int batchSize = 50;
    private long idleIntervalMs = 100;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the connection pool batches borrow from.
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
     * Sets the payload codec.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param codec the codec
     * @return this builder
     */
    public Builder codec(JsonCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the backoff applied after a batch had to be requeued.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=500} and {@code maxDelayMs=30000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for injected timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the maximum number of events sent per borrowed connection.
     *
     * <p>Optional. Defaults to {@code 50}.
     *
     * @param batchSize events per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how long the drain thread waits for an event before checking again.
     *
     * <p>Optional. Defaults to {@code 100} ms.
     *
     * @param idleIntervalMs idle wait in milliseconds
     * @return this builder
     */
    public Builder idleIntervalMs(long idleIntervalMs) {
      this.idleIntervalMs = idleIntervalMs;
      return this;
    }

    /**
     * Sets how long {@link EventPublisher#close()} lets the drain thread flush.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public EventPublisher build() {
      return new EventPublisher(this);
    }
  }
}
