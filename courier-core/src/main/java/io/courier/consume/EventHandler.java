package io.courier.consume;

import java.util.Map;

/**
 * Callback invoked by an {@link EventConsumer} for every decoded message.
 *
 * <p>Returning normally acknowledges the message. Throwing any exception negatively
 * acknowledges it with requeue, so it is delivered again later. Handlers may publish
 * further events and open database sessions.
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles one message.
     *
     * @param payload decoded JSON body (mutable copy owned by the handler)
     * @throws Exception to request redelivery
     */
    void handle(Map<String, Object> payload) throws Exception;
}
