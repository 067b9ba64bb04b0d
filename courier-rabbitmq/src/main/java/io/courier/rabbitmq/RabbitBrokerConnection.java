package io.courier.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import io.courier.spi.BrokerChannel;
import io.courier.spi.BrokerConnection;
import io.courier.spi.ConnectionLostException;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

final class RabbitBrokerConnection implements BrokerConnection {
  private static final Logger logger = Logger.getLogger(RabbitBrokerConnection.class.getName());

  private final Connection connection;
  private final Instant createdAt = Instant.now();

  RabbitBrokerConnection(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
    connection.addShutdownListener(cause -> {
      if (!cause.isInitiatedByApplication()) {
        logger.warning("RabbitMQ connection " + connection.getClientProvidedName()
            + " lost: " + cause.getMessage());
      }
    });
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public Instant createdAt() {
    return createdAt;
  }

  @Override
  public BrokerChannel openChannel() throws IOException {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (ShutdownSignalException e) {
      throw new ConnectionLostException("Connection closed: " + e.getMessage(), e);
    }
    if (channel == null) {
      throw new IOException("No channel available on " + connection.getClientProvidedName());
    }
    return new RabbitBrokerChannel(channel);
  }

  @Override
  public void close() {
    if (!connection.isOpen()) {
      return;
    }
    try {
      connection.close();
    } catch (IOException | ShutdownSignalException e) {
      logger.log(Level.FINE, "Error closing RabbitMQ connection", e);
    }
  }
}
