package io.courier.rabbitmq;

import io.courier.Courier;
import io.courier.broker.Topology;
import io.courier.consume.ConsumerState;
import io.courier.consume.EventConsumer;
import io.courier.retry.RetryPolicy;
import io.courier.spi.BrokerChannel;
import io.courier.spi.BrokerConnection;
import io.courier.spi.Delivery;
import io.courier.spi.OutboundMessage;
import io.courier.testing.Await;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DockerAvailable
@Testcontainers
class RabbitCourierIntegrationTest {

    @Container
    static final RabbitMQContainer rabbit =
            new RabbitMQContainer(DockerImageName.parse("rabbitmq:3-management-alpine"));

    private static RabbitBrokerConnectionFactory connectionFactory() {
        return RabbitBrokerConnectionFactory.builder()
                .host(rabbit.getHost())
                .port(rabbit.getAmqpPort())
                .username(rabbit.getAdminUsername())
                .password(rabbit.getAdminPassword())
                .build();
    }

    private static Courier.Builder courier() {
        return Courier.builder()
                .connectionFactory(connectionFactory())
                .poolCapacity(4)
                .reconnectPolicy(RetryPolicy.fixed(200))
                .receiveTimeoutMs(100)
                .idleIntervalMs(20);
    }

    @Test
    void channelRoundTripCarriesMessageProperties() throws Exception {
        String queue = "it_channel_" + UUID.randomUUID();
        try (BrokerConnection connection = connectionFactory().newConnection()) {
            Topology.defaults().declareOn(connection);
            try (BrokerChannel channel = connection.openChannel()) {
                channel.declareQueue(queue, true);
                channel.bindQueue(queue, Topology.USER_EVENTS, "user.#");
                channel.setPrefetch(1);
                channel.startConsuming(queue);

                channel.publish(new OutboundMessage(Topology.USER_EVENTS, "user.registered",
                        "{\"user_id\":1}".getBytes(StandardCharsets.UTF_8), "msg-1", Instant.now(), true));

                Delivery delivery = null;
                for (int i = 0; i < 50 && delivery == null; i++) {
                    delivery = channel.nextDelivery(100);
                }
                assertNotNull(delivery);
                assertEquals("msg-1", delivery.messageId());
                assertEquals("{\"user_id\":1}", new String(delivery.body(), StandardCharsets.UTF_8));
                channel.ack(delivery.deliveryTag());
                assertNull(channel.nextDelivery(100));
            }
        }
    }

    @Test
    void publishedEventIsConsumedFromDurableQueue() throws Exception {
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
        try (Courier courier = courier().build()) {
            EventConsumer consumer = courier.subscribe("auth_service_user_events", List.of("user.*"),
                    Topology.USER_EVENTS, received::add);
            courier.start();
            assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 30, TimeUnit.SECONDS));

            courier.publish(Topology.USER_EVENTS, "user.registered", Map.of("user_id", 42));

            Await.until(() -> received.size() == 1, 10_000, "event consumed");
            assertEquals(42, received.get(0).get("user_id"));
            assertEquals("user.registered", received.get(0).get("event_type"));
        }
    }

    @Test
    void failedMessageIsRedeliveredUntilHandled() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (Courier courier = courier().build()) {
            EventConsumer consumer = courier.subscribe("it_redelivery", List.of("order.created"),
                    Topology.ORDER_EVENTS, payload -> {
                        if (calls.incrementAndGet() < 3) {
                            throw new IllegalStateException("not yet");
                        }
                    });
            courier.start();
            assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 30, TimeUnit.SECONDS));

            courier.publish(Topology.ORDER_EVENTS, "order.created", Map.of("order_id", "o-1"));

            Await.until(() -> calls.get() == 3, 10_000, "handled on third delivery");
            Thread.sleep(300);
            assertEquals(3, calls.get());
        }
    }

    @Test
    void consumerRecoversWhenConnectionIsDropped() throws Exception {
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
        try (Courier courier = courier().build()) {
            EventConsumer consumer = courier.subscribe("it_recover", List.of("system.#"),
                    Topology.SYSTEM_EVENTS, received::add);
            courier.start();
            assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 30, TimeUnit.SECONDS));

            rabbit.execInContainer("rabbitmqctl", "close_all_connections", "test");

            Await.until(() -> consumer.state() != ConsumerState.CONSUMING, 10_000, "connection dropped");
            assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 30, TimeUnit.SECONDS));
            courier.publish(Topology.SYSTEM_EVENTS, "system.health", Map.of("ok", true));
            Await.until(() -> received.size() == 1, 10_000, "event after recovery");
        }
    }
}
