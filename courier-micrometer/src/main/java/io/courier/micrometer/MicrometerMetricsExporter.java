package io.courier.micrometer;

import io.courier.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code courier.publish.accepted}: events accepted into the outbound queue</li>
 *   <li>{@code courier.publish.success}: events handed to the broker</li>
 *   <li>{@code courier.publish.failure}: events whose publish failed (dropped)</li>
 *   <li>{@code courier.publish.batch.requeued}: batches put back for lack of a connection</li>
 *   <li>{@code courier.consume.ack}: deliveries acknowledged</li>
 *   <li>{@code courier.consume.requeue}: deliveries negatively acknowledged with requeue</li>
 *   <li>{@code courier.consume.reject}: deliveries rejected at the attempt cap</li>
 *   <li>{@code courier.consume.reconnect}: consumer reconnect cycles</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code courier.queue.outbound.depth}: events waiting in the outbound queue</li>
 *   <li>{@code courier.pool.live}: live broker connections</li>
 *   <li>{@code courier.pool.idle}: idle broker connections</li>
 *   <li>{@code courier.session.inflight}: open database sessions</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter publishAccepted;
  private final Counter publishSuccess;
  private final Counter publishFailure;
  private final Counter batchRequeued;
  private final Counter deliveryAcked;
  private final Counter deliveryRequeued;
  private final Counter deliveryRejected;
  private final Counter consumerReconnect;
  private final Gauge queueDepthGauge;
  private final Gauge poolLiveGauge;
  private final Gauge poolIdleGauge;
  private final Gauge sessionsGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger poolLive = new AtomicInteger();
  private final AtomicInteger poolIdle = new AtomicInteger();
  private final AtomicInteger sessionsInFlight = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "courier"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "courier");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "auth.courier"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.publishAccepted = Counter.builder(namePrefix + ".publish.accepted")
        .description("Events accepted into the outbound queue")
        .register(registry);
    this.publishSuccess = Counter.builder(namePrefix + ".publish.success")
        .description("Events handed to the broker")
        .register(registry);
    this.publishFailure = Counter.builder(namePrefix + ".publish.failure")
        .description("Events whose publish failed and were dropped")
        .register(registry);
    this.batchRequeued = Counter.builder(namePrefix + ".publish.batch.requeued")
        .description("Batches requeued because no broker connection was available")
        .register(registry);
    this.deliveryAcked = Counter.builder(namePrefix + ".consume.ack")
        .description("Deliveries acknowledged after successful handling")
        .register(registry);
    this.deliveryRequeued = Counter.builder(namePrefix + ".consume.requeue")
        .description("Deliveries negatively acknowledged with requeue")
        .register(registry);
    this.deliveryRejected = Counter.builder(namePrefix + ".consume.reject")
        .description("Deliveries rejected after reaching the attempt cap")
        .register(registry);
    this.consumerReconnect = Counter.builder(namePrefix + ".consume.reconnect")
        .description("Consumer reconnect cycles")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.outbound.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.poolLiveGauge = Gauge.builder(namePrefix + ".pool.live", poolLive, AtomicInteger::get)
        .register(registry);
    this.poolIdleGauge = Gauge.builder(namePrefix + ".pool.idle", poolIdle, AtomicInteger::get)
        .register(registry);
    this.sessionsGauge = Gauge.builder(namePrefix + ".session.inflight", sessionsInFlight, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementPublishAccepted() {
    if (closed) return;
    publishAccepted.increment();
  }

  @Override
  public void incrementPublishSuccess() {
    if (closed) return;
    publishSuccess.increment();
  }

  @Override
  public void incrementPublishFailure() {
    if (closed) return;
    publishFailure.increment();
  }

  @Override
  public void incrementBatchRequeued() {
    if (closed) return;
    batchRequeued.increment();
  }

  @Override
  public void recordOutboundQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void incrementDeliveryAcked() {
    if (closed) return;
    deliveryAcked.increment();
  }

  @Override
  public void incrementDeliveryRequeued() {
    if (closed) return;
    deliveryRequeued.increment();
  }

  @Override
  public void incrementDeliveryRejected() {
    if (closed) return;
    deliveryRejected.increment();
  }

  @Override
  public void incrementConsumerReconnect() {
    if (closed) return;
    consumerReconnect.increment();
  }

  @Override
  public void recordPoolState(int live, int idle) {
    if (closed) return;
    poolLive.set(live);
    poolIdle.set(idle);
  }

  @Override
  public void recordSessionsInFlight(int inFlight) {
    if (closed) return;
    sessionsInFlight.set(inFlight);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.courier.Courier#close()} calls this so that no stale gauges remain.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(publishAccepted, publishSuccess, publishFailure, batchRequeued,
        deliveryAcked, deliveryRequeued, deliveryRejected, consumerReconnect,
        queueDepthGauge, poolLiveGauge, poolIdleGauge, sessionsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
