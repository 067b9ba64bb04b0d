package io.courier.consume;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A durable queue bound to an exchange under one or more routing keys, with the handler
 * that processes its messages.
 *
 * @param queueName   durable queue name
 * @param exchange    exchange the queue is bound to
 * @param routingKeys binding keys, in declaration order
 * @param handler     message handler
 */
public record Subscription(String queueName, String exchange, Set<String> routingKeys, EventHandler handler) {

  public Subscription {
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(exchange, "exchange");
    Objects.requireNonNull(routingKeys, "routingKeys");
    Objects.requireNonNull(handler, "handler");
    if (queueName.isEmpty()) {
      throw new IllegalArgumentException("queueName must not be empty");
    }
    if (exchange.isEmpty()) {
      throw new IllegalArgumentException("exchange must not be empty");
    }
    if (routingKeys.isEmpty()) {
      throw new IllegalArgumentException("at least one routing key is required");
    }
    Set<String> keys = new LinkedHashSet<>();
    for (String key : routingKeys) {
      keys.add(Objects.requireNonNull(key, "routing key"));
    }
    routingKeys = Collections.unmodifiableSet(keys);
  }

  public static Subscription of(String queueName, Collection<String> routingKeys, String exchange,
      EventHandler handler) {
    Objects.requireNonNull(routingKeys, "routingKeys");
    return new Subscription(queueName, exchange, new LinkedHashSet<>(routingKeys), handler);
  }
}
