package io.courier.consume;

import io.courier.broker.BrokerConnectionPoolFactory;
import io.courier.broker.Topology;
import io.courier.pool.ResourcePool;
import io.courier.retry.RetryPolicy;
import io.courier.spi.BrokerConnection;
import io.courier.testing.Await;
import io.courier.testing.FakeBroker;
import io.courier.testing.RecordingMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventConsumerTest {

    private static final String QUEUE = "auth_service_user_events";

    private final FakeBroker broker = new FakeBroker();
    private final RecordingMetrics metrics = new RecordingMetrics();
    private final ResourcePool<BrokerConnection> pool = ResourcePool
            .builder(new BrokerConnectionPoolFactory(broker, Topology.defaults()))
            .capacity(2)
            .acquireTimeout(Duration.ofMillis(200))
            .creationAttempts(1)
            .build();
    private EventConsumer consumer;

    @AfterEach
    void tearDown() {
        if (consumer != null) {
            consumer.close();
        }
        pool.closeAll();
    }

    private EventConsumer start(EventHandler handler, int maxDeliveryAttempts) {
        consumer = EventConsumer.builder()
                .pool(pool)
                .subscription(Subscription.of(QUEUE, List.of("user.*"), Topology.USER_EVENTS, handler))
                .retryPolicy(RetryPolicy.fixed(20))
                .metrics(metrics)
                .maxDeliveryAttempts(maxDeliveryAttempts)
                .receiveTimeoutMs(50)
                .build();
        consumer.start();
        return consumer;
    }

    private void send(String routingKey, String json, String messageId) {
        broker.deliver(Topology.USER_EVENTS, routingKey, json.getBytes(StandardCharsets.UTF_8), messageId);
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingSubscription() {
        assertThrows(NullPointerException.class, () -> EventConsumer.builder().pool(pool).build());
    }

    @Test
    void builderRejectsNegativeAttemptCap() {
        Subscription subscription = Subscription.of(QUEUE, List.of("user.*"), Topology.USER_EVENTS, p -> {});
        assertThrows(IllegalArgumentException.class, () ->
                EventConsumer.builder().pool(pool).subscription(subscription).maxDeliveryAttempts(-1).build());
    }

    @Test
    void subscriptionRequiresRoutingKeys() {
        assertThrows(IllegalArgumentException.class, () ->
                Subscription.of(QUEUE, List.of(), Topology.USER_EVENTS, p -> {}));
    }

    // ── Binding and delivery ────────────────────────────────────────

    @Test
    void declaresDurableQueueBindsKeysAndSetsPrefetch() throws Exception {
        consumer = EventConsumer.builder()
                .pool(pool)
                .subscription(Subscription.of(QUEUE, List.of("user.registered", "user.deleted"),
                        Topology.USER_EVENTS, p -> {}))
                .receiveTimeoutMs(50)
                .build();
        consumer.start();

        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
        assertTrue(broker.queueExists(QUEUE));
        assertEquals(2, broker.bindings(QUEUE).size());
        assertEquals(1, broker.lastPrefetch());
    }

    @Test
    void successfulHandlingAcknowledgesDelivery() throws Exception {
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
        start(received::add, 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.registered", "{\"user_id\":42,\"profile\":{\"email\":\"a@example.com\"}}", "m-1");

        Await.until(() -> metrics.deliveryAcked.get() == 1, 5000, "acked");
        assertEquals(1, received.size());
        assertEquals(42, received.get(0).get("user_id"));
        assertEquals(Map.of("email", "a@example.com"), received.get(0).get("profile"));
        assertEquals(0, broker.readyCount(QUEUE));
        assertEquals(0, broker.unackedCount(QUEUE));
    }

    @Test
    void unmatchedRoutingKeyIsNotDelivered() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(p -> calls.incrementAndGet(), 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("order.created", "{}", "m-1");
        send("user.login", "{}", "m-2");

        Await.until(() -> calls.get() == 1, 5000, "one delivery");
        Thread.sleep(100);
        assertEquals(1, calls.get());
    }

    @Test
    void failedHandlingIsRequeuedAndRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(p -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("transient");
            }
        }, 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.registered", "{\"user_id\":1}", "m-1");

        Await.until(() -> metrics.deliveryAcked.get() == 1, 5000, "acked after retry");
        assertEquals(2, calls.get());
        assertEquals(1, metrics.deliveryRequeued.get());
        assertEquals(0, broker.readyCount(QUEUE));
        assertEquals(0, broker.unackedCount(QUEUE));
    }

    @Test
    void undecodableBodyIsTreatedAsHandlerFailure() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(p -> calls.incrementAndGet(), 1);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.registered", "not json", "m-1");

        Await.until(() -> metrics.deliveryRejected.get() == 1, 5000, "rejected");
        assertEquals(0, calls.get());
        assertEquals(1, broker.rejected().size());
    }

    @Test
    void messageIsRejectedAfterAttemptCap() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(p -> {
            calls.incrementAndGet();
            throw new IllegalStateException("always fails");
        }, 3);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.registered", "{\"user_id\":1}", "m-1");

        Await.until(() -> metrics.deliveryRejected.get() == 1, 5000, "rejected");
        assertEquals(3, calls.get());
        assertEquals(2, metrics.deliveryRequeued.get());
        assertEquals(0, broker.readyCount(QUEUE));
        assertEquals(1, broker.rejected().size());
    }

    @Test
    void handlerErrorDoesNotStopConsumption() throws Exception {
        List<Object> handled = new CopyOnWriteArrayList<>();
        start(p -> {
            if ("bad".equals(p.get("kind"))) {
                throw new IllegalArgumentException("bad payload");
            }
            handled.add(p.get("kind"));
        }, 1);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.a", "{\"kind\":\"bad\"}", "m-1");
        send("user.b", "{\"kind\":\"good\"}", "m-2");

        Await.until(() -> handled.size() == 1, 5000, "good message handled");
        assertEquals(ConsumerState.CONSUMING, consumer.state());
    }

    @Test
    void assertionErrorFromHandlerIsRequeued() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(p -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("handler invariant broken");
            }
        }, 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.registered", "{\"user_id\":1}", "m-1");

        Await.until(() -> metrics.deliveryAcked.get() == 1, 5000, "acked after retry");
        assertEquals(2, calls.get());
        assertEquals(1, metrics.deliveryRequeued.get());
        assertEquals(ConsumerState.CONSUMING, consumer.state());
    }

    @Test
    void virtualMachineErrorFromHandlerTriggersReconnect() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        start(p -> {
            if (calls.incrementAndGet() == 1) {
                throw new StackOverflowError("deep recursion");
            }
        }, 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.registered", "{\"user_id\":1}", "m-1");

        Await.until(() -> metrics.deliveryAcked.get() == 1, 5000, "handled after reconnect");
        assertEquals(2, calls.get());
        assertEquals(1, metrics.deliveryRequeued.get());
        assertTrue(metrics.consumerReconnect.get() >= 1);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
        assertEquals(1, pool.liveCount());
    }

    // ── Reconnect ───────────────────────────────────────────────────

    @Test
    void reconnectsAfterConnectionLoss() throws Exception {
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
        start(received::add, 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        broker.killConnections();

        Await.until(() -> metrics.consumerReconnect.get() >= 1, 5000, "reconnect cycle");
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
        send("user.registered", "{\"user_id\":5}", "m-1");
        Await.until(() -> received.size() == 1, 5000, "delivery after reconnect");
        assertEquals(1, pool.liveCount());
    }

    @Test
    void redeliversUnackedMessageAfterConnectionLoss() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        java.util.concurrent.CountDownLatch inHandler = new java.util.concurrent.CountDownLatch(1);
        java.util.concurrent.CountDownLatch proceed = new java.util.concurrent.CountDownLatch(1);
        start(p -> {
            if (calls.incrementAndGet() == 1) {
                inHandler.countDown();
                proceed.await();
            }
        }, 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        send("user.registered", "{\"user_id\":9}", "m-1");
        assertTrue(inHandler.await(5, TimeUnit.SECONDS));
        broker.killConnections();
        proceed.countDown();

        Await.until(() -> metrics.deliveryAcked.get() == 1, 5000, "acked on redelivery");
        assertEquals(2, calls.get());
    }

    @Test
    void keepsRetryingWhileBrokerIsDown() throws Exception {
        broker.setAvailable(false);
        AtomicInteger calls = new AtomicInteger();
        start(p -> calls.incrementAndGet(), 0);

        Await.until(() -> metrics.consumerReconnect.get() >= 3, 5000, "several reconnect attempts");

        broker.setAvailable(true);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
        send("user.registered", "{}", "m-1");
        Await.until(() -> calls.get() == 1, 5000, "delivered after broker came back");
    }

    // ── Close ───────────────────────────────────────────────────────

    @Test
    void closeStopsConsumerAndReturnsConnection() throws Exception {
        start(p -> {}, 0);
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

        consumer.close();

        assertEquals(ConsumerState.STOPPED, consumer.state());
        assertEquals(0, pool.checkedOutCount());
        assertEquals(1, pool.idleCount());
    }

    @Test
    void closeBeforeStartMarksStopped() {
        Subscription subscription = Subscription.of(QUEUE, List.of("user.*"), Topology.USER_EVENTS, p -> {});
        EventConsumer idle = EventConsumer.builder().pool(pool).subscription(subscription).build();

        idle.close();

        assertEquals(ConsumerState.STOPPED, idle.state());
        assertThrows(IllegalStateException.class, idle::start);
    }
}
