package io.courier.spi;

import java.io.IOException;

/**
 * A lightweight session multiplexed over a {@link BrokerConnection}. Channels are not
 * thread-safe and are never shared between publisher batches or consumers.
 */
public interface BrokerChannel extends AutoCloseable {

    boolean isOpen();

    /**
     * Declares an exchange. Redeclaring with the same arguments is a no-op.
     */
    void declareExchange(String exchange, ExchangeType type, boolean durable) throws IOException;

    /**
     * Declares a queue. Redeclaring with the same arguments is a no-op.
     */
    void declareQueue(String queue, boolean durable) throws IOException;

    void bindQueue(String queue, String exchange, String routingKey) throws IOException;

    /**
     * Limits the number of unacknowledged deliveries held by this channel.
     */
    void setPrefetch(int count) throws IOException;

    /**
     * Publishes a message. Does not wait for broker confirmation.
     */
    void publish(OutboundMessage message) throws IOException;

    /**
     * Registers this channel as a consumer of {@code queue}. Deliveries are then pulled
     * with {@link #nextDelivery(long)}.
     */
    void startConsuming(String queue) throws IOException;

    /**
     * Waits for the next delivery.
     *
     * @param timeoutMs maximum wait in milliseconds
     * @return the next delivery, or {@code null} if none arrived in time
     * @throws ConnectionLostException if the channel or its connection shut down abnormally
     * @throws IOException if consumption was never started or the channel was closed
     * @throws InterruptedException if interrupted while waiting
     */
    Delivery nextDelivery(long timeoutMs) throws IOException, InterruptedException;

    void ack(long deliveryTag) throws IOException;

    void nack(long deliveryTag, boolean requeue) throws IOException;

    /**
     * Closes the channel. Never throws.
     */
    @Override
    void close();
}
