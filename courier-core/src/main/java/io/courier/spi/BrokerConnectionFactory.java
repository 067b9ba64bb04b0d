package io.courier.spi;

import java.io.IOException;

/**
 * Opens authenticated sessions to the message broker.
 *
 * @see io.courier.broker.BrokerConnectionPoolFactory
 */
@FunctionalInterface
public interface BrokerConnectionFactory {

    /**
     * Performs the broker handshake and returns an open connection.
     *
     * @return a new open connection; the caller owns it
     * @throws IOException if the broker is unreachable or rejects the credentials
     */
    BrokerConnection newConnection() throws IOException;
}
