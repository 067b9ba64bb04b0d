package io.courier.spi;

import java.io.IOException;
import java.time.Instant;

/**
 * A single authenticated session to the broker. Connections are pooled by
 * {@link io.courier.pool.ResourcePool} and lent to one caller at a time; channels opened on
 * a connection belong to the caller that opened them.
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * @return {@code true} while the underlying session is usable
     */
    boolean isOpen();

    /**
     * @return when this connection was established
     */
    Instant createdAt();

    /**
     * Opens a new channel on this connection.
     *
     * @return an open channel; the caller must close it
     * @throws IOException if the connection is broken
     */
    BrokerChannel openChannel() throws IOException;

    /**
     * Closes the connection and every channel opened on it. Never throws.
     */
    @Override
    void close();
}
