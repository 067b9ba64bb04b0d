package io.courier.demo;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.courier.Courier;
import io.courier.broker.Topology;
import io.courier.consume.ConsumerState;
import io.courier.consume.EventConsumer;
import io.courier.jdbc.DataSourceConnectionProvider;
import io.courier.jdbc.session.SessionManager;
import io.courier.rabbitmq.RabbitBrokerConnectionFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Demo of the auth service messaging layer: a user is registered in one database session,
 * the {@code user.registered} event goes out after commit, and a consumer records an audit
 * row for it in a session of its own. Handler failures are reported on {@code system_events}.
 *
 * <p>Needs a reachable RabbitMQ; set {@code RABBITMQ_HOST}, {@code RABBITMQ_PORT},
 * {@code RABBITMQ_USER} and {@code RABBITMQ_PASSWORD} as required.
 *
 * Run with: mvn -pl samples/courier-demo exec:java -Dexec.mainClass=io.courier.demo.CourierDemo
 */
public final class CourierDemo {

  public static void main(String[] args) throws Exception {
    // 1. H2 behind HikariCP
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl("jdbc:h2:mem:auth;DB_CLOSE_DELAY=-1");
    hikari.setMaximumPoolSize(5);

    try (HikariDataSource dataSource = new HikariDataSource(hikari)) {
      createSchema(dataSource);

      SessionManager sessions = SessionManager.builder()
          .connectionProvider(new DataSourceConnectionProvider(dataSource))
          .build();
      sessions.verifyConnectivity();

      // 2. Broker from RABBITMQ_* environment variables
      RabbitBrokerConnectionFactory connectionFactory = RabbitBrokerConnectionFactory.builder()
          .fromEnvironment(System.getenv())
          .clientName("auth-service")
          .build();

      CountDownLatch audited = new CountDownLatch(2);

      try (Courier courier = Courier.builder()
          .connectionFactory(connectionFactory)
          .poolCapacity(5)
          .build()) {

        // 3. Consumer: audit every user event in its own session
        EventConsumer consumer = courier.subscribe("auth_service_user_events", List.of("user.*"),
            Topology.USER_EVENTS, payload -> {
              try {
                sessions.withSession(session -> {
                  try (PreparedStatement ps = session.connection().prepareStatement(
                      "INSERT INTO audit_log (event_type, user_id) VALUES (?, ?)")) {
                    ps.setString(1, String.valueOf(payload.get("event_type")));
                    ps.setLong(2, ((Number) payload.get("user_id")).longValue());
                    ps.executeUpdate();
                  }
                  return null;
                });
                System.out.println("[Consumer] audited " + payload.get("event_type")
                    + " trace_id=" + payload.get("trace_id"));
              } catch (Exception e) {
                courier.publish(Topology.SYSTEM_EVENTS, "system.error", Map.of(
                    "source", "audit",
                    "error", String.valueOf(e.getMessage()),
                    "trace_id", String.valueOf(payload.get("trace_id"))));
                throw e;
              } finally {
                audited.countDown();
              }
            });

        courier.start();
        if (!consumer.awaitState(ConsumerState.CONSUMING, 30, TimeUnit.SECONDS)) {
          System.out.println("Consumer not ready, state=" + consumer.state());
        }

        System.out.println("=== Courier Demo ===\n");

        // 4. Register users; events leave only after the row is committed
        registerUser(sessions, courier, 1, "alice@example.com");
        registerUser(sessions, courier, 2, "bob@example.com");

        // 5. A registration that fails publishes nothing
        try {
          registerUser(sessions, courier, 1, "duplicate@example.com");
        } catch (SQLException e) {
          System.out.println("Duplicate registration rolled back: " + e.getMessage() + "\n");
        }

        boolean completed = audited.await(10, TimeUnit.SECONDS);
        System.out.println(completed ? "\nAll events audited" : "\nTimeout waiting for events");

        System.out.println("\n=== Database State ===");
        showState(dataSource);
      }
    }

    System.out.println("\nDemo complete.");
  }

  private static void registerUser(SessionManager sessions, Courier courier, long id, String email)
      throws SQLException {
    sessions.withSession(session -> {
      try (PreparedStatement ps = session.connection().prepareStatement(
          "INSERT INTO users (id, email) VALUES (?, ?)")) {
        ps.setLong(1, id);
        ps.setString(2, email);
        ps.executeUpdate();
      }
      session.afterCommit(() -> courier.publish(Topology.USER_EVENTS, "user.registered",
          Map.of("user_id", id, "email", email)));
      return null;
    });
    System.out.println("Registered user " + id + " <" + email + ">");
  }

  private static void createSchema(HikariDataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute(
          "CREATE TABLE users (id BIGINT PRIMARY KEY, email VARCHAR(255) NOT NULL)");
      conn.createStatement().execute(
          "CREATE TABLE audit_log (" +
              "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
              "event_type VARCHAR(64) NOT NULL," +
              "user_id BIGINT NOT NULL," +
              "recorded_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP" +
              ")");
    }
  }

  private static void showState(HikariDataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      ResultSet rs = conn.createStatement().executeQuery(
          "SELECT u.id, u.email, COUNT(a.id) AS audits FROM users u " +
              "LEFT JOIN audit_log a ON a.user_id = u.id GROUP BY u.id, u.email ORDER BY u.id");
      System.out.printf("%-6s | %-25s | %s%n", "ID", "EMAIL", "AUDITS");
      System.out.println("-".repeat(48));
      while (rs.next()) {
        System.out.printf("%-6d | %-25s | %d%n",
            rs.getLong("id"), rs.getString("email"), rs.getInt("audits"));
      }
    }
  }
}
