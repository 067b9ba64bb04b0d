package io.courier.rabbitmq;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.courier.spi.BrokerConnection;
import io.courier.spi.BrokerConnectionFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Opens RabbitMQ connections with the official Java client.
 *
 * <p>Automatic recovery in the client is switched off: broken connections are discarded
 * by the pool and consumers re-run their own declare/bind cycle, so the client must not
 * recover topology behind their back.
 *
 * <pre>{@code
 * BrokerConnectionFactory factory = RabbitBrokerConnectionFactory.builder()
 *     .fromEnvironment(System.getenv())
 *     .build();
 * }</pre>
 */
public final class RabbitBrokerConnectionFactory implements BrokerConnectionFactory {
  private static final Logger logger = Logger.getLogger(RabbitBrokerConnectionFactory.class.getName());

  public static final String ENV_HOST = "RABBITMQ_HOST";
  public static final String ENV_PORT = "RABBITMQ_PORT";
  public static final String ENV_USER = "RABBITMQ_USER";
  public static final String ENV_PASSWORD = "RABBITMQ_PASSWORD";
  public static final String ENV_VHOST = "RABBITMQ_VHOST";

  private final ConnectionFactory connectionFactory;
  private final String clientName;
  private final AtomicInteger sequence = new AtomicInteger(1);

  private RabbitBrokerConnectionFactory(Builder builder) {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(builder.host);
    factory.setPort(builder.port);
    factory.setVirtualHost(builder.virtualHost);
    factory.setUsername(builder.username);
    factory.setPassword(builder.password);
    factory.setRequestedHeartbeat(builder.heartbeatSeconds);
    factory.setConnectionTimeout(builder.connectionTimeoutMs);
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    this.connectionFactory = factory;
    this.clientName = builder.clientName;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public BrokerConnection newConnection() throws IOException {
    try {
      Connection connection = connectionFactory.newConnection(clientName + "-" + sequence.getAndIncrement());
      logger.fine(() -> "Opened RabbitMQ connection to " + describe());
      return new RabbitBrokerConnection(connection);
    } catch (TimeoutException e) {
      throw new IOException("Timed out connecting to " + describe(), e);
    }
  }

  public String host() {
    return connectionFactory.getHost();
  }

  public int port() {
    return connectionFactory.getPort();
  }

  public String virtualHost() {
    return connectionFactory.getVirtualHost();
  }

  public String username() {
    return connectionFactory.getUsername();
  }

  public int heartbeatSeconds() {
    return connectionFactory.getRequestedHeartbeat();
  }

  public int connectionTimeoutMs() {
    return connectionFactory.getConnectionTimeout();
  }

  private String describe() {
    return connectionFactory.getHost() + ":" + connectionFactory.getPort() + connectionFactory.getVirtualHost();
  }

  @Override
  public String toString() {
    return "RabbitBrokerConnectionFactory{" + username() + "@" + describe() + "}";
  }

  /** Builder for {@link RabbitBrokerConnectionFactory}. */
  public static final class Builder {
    private String host = "rabbitmq";
    private int port = 5672;
    private String virtualHost = "/";
    private String username = "user";
    private String password = "password";
    private int heartbeatSeconds = 600;
    private int connectionTimeoutMs = 10_000;
    private String clientName = "courier";

    private Builder() {}

    /**
     * Applies {@code RABBITMQ_HOST}, {@code RABBITMQ_PORT}, {@code RABBITMQ_USER},
     * {@code RABBITMQ_PASSWORD} and {@code RABBITMQ_VHOST} from {@code env}. Absent or blank
     * entries keep the current value.
     *
     * @param env environment variables, usually {@code System.getenv()}
     * @return this builder
     * @throws IllegalArgumentException if {@code RABBITMQ_PORT} is not a number
     */
    public Builder fromEnvironment(Map<String, String> env) {
      Objects.requireNonNull(env, "env");
      String value = env.get(ENV_HOST);
      if (value != null && !value.isBlank()) {
        host(value.trim());
      }
      value = env.get(ENV_PORT);
      if (value != null && !value.isBlank()) {
        try {
          port(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(ENV_PORT + " is not a valid port: " + value, e);
        }
      }
      value = env.get(ENV_USER);
      if (value != null && !value.isBlank()) {
        username(value);
      }
      value = env.get(ENV_PASSWORD);
      if (value != null && !value.isEmpty()) {
        password(value);
      }
      value = env.get(ENV_VHOST);
      if (value != null && !value.isBlank()) {
        virtualHost(value.trim());
      }
      return this;
    }

    /**
     * Sets the broker host.
     *
     * <p>Optional. Defaults to {@code rabbitmq}.
     *
     * @param host host name or address
     * @return this builder
     */
    public Builder host(String host) {
      this.host = Objects.requireNonNull(host, "host");
      return this;
    }

    /**
     * Sets the broker port.
     *
     * <p>Optional. Defaults to {@code 5672}.
     *
     * @param port AMQP port
     * @return this builder
     */
    public Builder port(int port) {
      if (port < 1 || port > 65535) {
        throw new IllegalArgumentException("port must be in 1..65535, got: " + port);
      }
      this.port = port;
      return this;
    }

    public Builder virtualHost(String virtualHost) {
      this.virtualHost = Objects.requireNonNull(virtualHost, "virtualHost");
      return this;
    }

    public Builder username(String username) {
      this.username = Objects.requireNonNull(username, "username");
      return this;
    }

    public Builder password(String password) {
      this.password = Objects.requireNonNull(password, "password");
      return this;
    }

    /**
     * Sets the requested heartbeat interval.
     *
     * <p>Optional. Defaults to {@code 600} seconds.
     *
     * @param heartbeatSeconds heartbeat in seconds, 0 to disable
     * @return this builder
     */
    public Builder heartbeatSeconds(int heartbeatSeconds) {
      if (heartbeatSeconds < 0) {
        throw new IllegalArgumentException("heartbeatSeconds must be >= 0");
      }
      this.heartbeatSeconds = heartbeatSeconds;
      return this;
    }

    public Builder connectionTimeoutMs(int connectionTimeoutMs) {
      if (connectionTimeoutMs < 0) {
        throw new IllegalArgumentException("connectionTimeoutMs must be >= 0");
      }
      this.connectionTimeoutMs = connectionTimeoutMs;
      return this;
    }

    /**
     * Sets the prefix of the client-provided connection name shown in the management UI.
     *
     * <p>Optional. Defaults to {@code courier}.
     *
     * @param clientName connection name prefix
     * @return this builder
     */
    public Builder clientName(String clientName) {
      this.clientName = Objects.requireNonNull(clientName, "clientName");
      return this;
    }

    public RabbitBrokerConnectionFactory build() {
      return new RabbitBrokerConnectionFactory(this);
    }
  }
}
