package io.courier;

import io.courier.broker.Topology;
import io.courier.consume.ConsumerState;
import io.courier.consume.EventConsumer;
import io.courier.retry.RetryPolicy;
import io.courier.testing.Await;
import io.courier.testing.FakeBroker;
import io.courier.testing.RecordingMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CourierTest {

    private final FakeBroker broker = new FakeBroker();

    private Courier.Builder builder() {
        return Courier.builder()
                .connectionFactory(broker)
                .poolCapacity(4)
                .creationRetryPolicy(RetryPolicy.fixed(10))
                .publishRetryPolicy(RetryPolicy.fixed(20))
                .reconnectPolicy(RetryPolicy.fixed(20))
                .idleIntervalMs(20)
                .receiveTimeoutMs(50);
    }

    @Test
    void builderRequiresConnectionFactory() {
        assertThrows(NullPointerException.class, () -> Courier.builder().build());
    }

    @Test
    void publishedEventReachesSubscriber() throws Exception {
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
        try (Courier courier = builder().build()) {
            EventConsumer consumer = courier.subscribe("auth_service_user_events", List.of("user.*"),
                    Topology.USER_EVENTS, received::add);
            courier.start();
            assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

            assertTrue(courier.publish(Topology.USER_EVENTS, "user.registered", Map.of("user_id", 42)));

            Await.until(() -> received.size() == 1, 5000, "event delivered");
            Map<String, Object> payload = received.get(0);
            assertEquals(42, payload.get("user_id"));
            assertEquals("user.registered", payload.get("event_type"));
            assertTrue(payload.containsKey("trace_id"));
            assertTrue(payload.containsKey("timestamp"));
        }
    }

    @Test
    void consumersAndPublisherShareOnePool() throws Exception {
        try (Courier courier = builder().build()) {
            EventConsumer users = courier.subscribe("q_users", List.of("user.#"), Topology.USER_EVENTS, p -> {});
            EventConsumer orders = courier.subscribe("q_orders", List.of("order.#"), Topology.ORDER_EVENTS, p -> {});
            courier.start();
            assertTrue(users.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
            assertTrue(orders.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

            assertEquals(2, courier.pool().checkedOutCount());
            assertEquals(2, courier.consumers().size());
        }
    }

    @Test
    void subscribeAfterStartStartsConsumerImmediately() throws Exception {
        try (Courier courier = builder().build()) {
            courier.start();
            EventConsumer consumer = courier.subscribe("late", List.of("user.*"), Topology.USER_EVENTS, p -> {});

            assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
        }
    }

    @Test
    void closeStopsEverythingAndClosesPool() throws Exception {
        RecordingMetrics metrics = new RecordingMetrics();
        Courier courier = builder().metrics(metrics).build();
        EventConsumer consumer = courier.subscribe("q", List.of("user.*"), Topology.USER_EVENTS, p -> {});
        courier.start();
        assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
        courier.publish(Topology.USER_EVENTS, "audit.only", Map.of());

        courier.close();

        assertEquals(ConsumerState.STOPPED, consumer.state());
        assertTrue(courier.pool().isClosed());
        assertEquals(0, courier.pool().liveCount());
        assertEquals(0, broker.openConnections());
        assertEquals(1, broker.published().size());
        assertFalse(courier.publish(Topology.USER_EVENTS, "user.x", Map.of()));
        assertThrows(IllegalStateException.class, courier::start);
    }

    @Test
    void closeIsIdempotent() {
        Courier courier = builder().build();
        courier.close();
        courier.close();
    }
}
