package io.courier.spring.boot;

import io.courier.Courier;
import io.courier.broker.Topology;
import io.courier.consume.ConsumerState;
import io.courier.consume.EventConsumer;
import io.courier.consume.EventHandler;
import io.courier.jdbc.ConnectionProvider;
import io.courier.jdbc.DataSourceConnectionProvider;
import io.courier.jdbc.session.SessionException;
import io.courier.jdbc.session.SessionManager;
import io.courier.rabbitmq.RabbitBrokerConnectionFactory;
import io.courier.spi.BrokerConnectionFactory;
import io.courier.testing.Await;
import io.courier.testing.FakeBroker;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CourierAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(CourierAutoConfiguration.class))
      .withUserConfiguration(FakeBrokerConfig.class)
      .withPropertyValues(
          "courier.consumer.receive-timeout-ms=50",
          "courier.consumer.reconnect-delay-ms=50",
          "courier.publisher.idle-interval-ms=20");

  @Test
  void createsCourierBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("courier"));
      assertTrue(ctx.containsBean("courierLifecycle"));
      assertTrue(ctx.containsBean("courierListenerRegistrar"));
      assertFalse(ctx.containsBean("brokerConnectionFactory"));
      assertFalse(ctx.containsBean("sessionManager"));

      assertInstanceOf(FakeBroker.class, ctx.getBean(BrokerConnectionFactory.class));
      assertTrue(ctx.getBean(CourierLifecycle.class).isRunning());
    });
  }

  @Test
  void courierPublishesOnceContextIsRunning() {
    runner.run(ctx -> {
      var broker = ctx.getBean(FakeBroker.class);
      var courier = ctx.getBean(Courier.class);

      assertTrue(courier.publish(Topology.USER_EVENTS, "user.registered", Map.of("user_id", 7)));

      Await.until(() -> broker.published().size() == 1, 5_000, "event published");
      assertEquals("user.registered", broker.published().get(0).routingKey());
    });
  }

  @Test
  void subscribesAnnotatedListeners() {
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      var broker = ctx.getBean(FakeBroker.class);
      var courier = ctx.getBean(Courier.class);
      var handler = ctx.getBean(RecordingHandler.class);

      assertEquals(1, courier.consumers().size());
      EventConsumer consumer = courier.consumers().get(0);
      assertEquals("auto_test_user_events", consumer.subscription().queueName());
      assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));

      broker.deliver(Topology.USER_EVENTS, "user.registered",
          "{\"user_id\":3}".getBytes(StandardCharsets.UTF_8), "m-1");

      Await.until(() -> handler.received.size() == 1, 5_000, "listener invoked");
      assertEquals(3, handler.received.get(0).get("user_id"));
    });
  }

  @Test
  void appliesConsumerProperties() {
    runner
        .withPropertyValues("courier.consumer.prefetch=4")
        .withUserConfiguration(ListenerConfig.class).run(ctx -> {
          var broker = ctx.getBean(FakeBroker.class);
          EventConsumer consumer = ctx.getBean(Courier.class).consumers().get(0);
          assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
          assertEquals(4, broker.lastPrefetch());
        });
  }

  @Test
  void contextCloseStopsConsumersAndClosesPool() {
    Courier[] courier = new Courier[1];
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      courier[0] = ctx.getBean(Courier.class);
      EventConsumer consumer = courier[0].consumers().get(0);
      assertTrue(consumer.awaitState(ConsumerState.CONSUMING, 5, TimeUnit.SECONDS));
    });

    assertEquals(ConsumerState.STOPPED, courier[0].consumers().get(0).state());
    assertTrue(courier[0].pool().isClosed());
    assertFalse(courier[0].publish(Topology.USER_EVENTS, "user.registered", Map.of()));
  }

  @Test
  void defaultsToRabbitConnectionFactory() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CourierAutoConfiguration.class))
        .withPropertyValues(
            "courier.rabbitmq.host=broker.internal",
            "courier.rabbitmq.port=5673",
            "courier.rabbitmq.username=auth",
            "courier.rabbitmq.heartbeat-seconds=30")
        .run(ctx -> {
          var factory = ctx.getBean(RabbitBrokerConnectionFactory.class);
          assertEquals("broker.internal", factory.host());
          assertEquals(5673, factory.port());
          assertEquals("auth", factory.username());
          assertEquals(30, factory.heartbeatSeconds());
        });
  }

  @Test
  void createsSessionManagerWhenDataSourcePresent() {
    runner
        .withConfiguration(AutoConfigurations.of(DataSourceAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:courier_auto_test;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "courier.session.verify-on-startup=true")
        .run(ctx -> {
          assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
          var sessions = ctx.getBean(SessionManager.class);

          Integer one = sessions.withSession(session -> {
            try (var rs = session.connection().createStatement().executeQuery("SELECT 1")) {
              rs.next();
              return rs.getInt(1);
            }
          });

          assertEquals(1, one);
          assertEquals(0, sessions.inFlightSessions());
        });
  }

  @Test
  void failsStartupWhenDatabaseUnreachable() {
    runner
        .withUserConfiguration(UnreachableDataSourceConfig.class)
        .withPropertyValues(
            "courier.session.verify-on-startup=true",
            "courier.session.connectivity-attempts=2",
            "courier.session.connectivity-retry-delay-ms=1")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertTrue(hasCause(ctx.getStartupFailure(), SessionException.class));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner
        .withUserConfiguration(UnreachableDataSourceConfig.class, CustomSessionConfig.class)
        .run(ctx -> {
          assertEquals(1, ctx.getBeanNamesForType(SessionManager.class).length);
          assertTrue(ctx.containsBean("mySessionManager"));
        });
  }

  // ── Test configurations ──────────────────────────────────────

  @CourierListener(queue = "auto_test_user_events", exchange = Topology.USER_EVENTS,
      routingKeys = {"user.*"})
  static class RecordingHandler implements EventHandler {
    final List<Map<String, Object>> received = new CopyOnWriteArrayList<>();

    @Override
    public void handle(Map<String, Object> payload) {
      received.add(payload);
    }
  }

  @Configuration
  static class FakeBrokerConfig {
    @Bean
    FakeBroker fakeBroker() {
      return new FakeBroker();
    }
  }

  @Configuration
  static class ListenerConfig {
    @Bean
    RecordingHandler recordingHandler() {
      return new RecordingHandler();
    }
  }

  @Configuration
  static class CustomSessionConfig {
    @Bean
    SessionManager mySessionManager() {
      return SessionManager.builder()
          .connectionProvider(() -> {
            throw new SQLException("not used");
          })
          .build();
    }
  }

  @Configuration
  static class UnreachableDataSourceConfig {
    @Bean
    DataSource dataSource() {
      JdbcDataSource dataSource = new JdbcDataSource();
      dataSource.setURL("jdbc:h2:tcp://127.0.0.1:1/unreachable");
      return dataSource;
    }
  }

  private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
    while (t != null) {
      if (type.isInstance(t)) {
        return true;
      }
      t = t.getCause() != t ? t.getCause() : null;
    }
    return false;
  }
}
