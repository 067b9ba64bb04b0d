package io.courier.broker;

import io.courier.pool.PooledObjectFactory;
import io.courier.spi.BrokerConnection;
import io.courier.spi.BrokerConnectionFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PooledObjectFactory} that opens a broker connection and declares the
 * {@link Topology} on it before handing it to the pool.
 */
public final class BrokerConnectionPoolFactory implements PooledObjectFactory<BrokerConnection> {
  private static final Logger logger = Logger.getLogger(BrokerConnectionPoolFactory.class.getName());

  private final BrokerConnectionFactory connectionFactory;
  private final Topology topology;

  public BrokerConnectionPoolFactory(BrokerConnectionFactory connectionFactory, Topology topology) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.topology = Objects.requireNonNull(topology, "topology");
  }

  @Override
  public BrokerConnection create() throws IOException {
    BrokerConnection connection = connectionFactory.newConnection();
    try {
      topology.declareOn(connection);
    } catch (IOException | RuntimeException e) {
      connection.close();
      throw e;
    }
    logger.info("Connected to broker, declared " + topology.exchanges().size() + " exchange(s)");
    return connection;
  }

  @Override
  public boolean isHealthy(BrokerConnection connection) {
    return connection.isOpen();
  }

  @Override
  public void destroy(BrokerConnection connection) {
    try {
      connection.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close broker connection", e);
    }
  }
}
