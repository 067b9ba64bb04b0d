package io.courier.spi;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A message ready to be handed to {@link BrokerChannel#publish(OutboundMessage)}. Equality
 * compares the body by content.
 *
 * @param exchange    target exchange
 * @param routingKey  routing key
 * @param body        UTF-8 JSON body
 * @param messageId   unique id used by consumers for redelivery accounting
 * @param timestamp   publish time
 * @param persistent  whether the broker should write the message to disk
 */
public record OutboundMessage(
    String exchange,
    String routingKey,
    byte[] body,
    String messageId,
    Instant timestamp,
    boolean persistent) {

  public static final String CONTENT_TYPE = "application/json";

  public OutboundMessage {
    Objects.requireNonNull(exchange, "exchange");
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OutboundMessage other)) {
      return false;
    }
    return persistent == other.persistent
        && exchange.equals(other.exchange)
        && routingKey.equals(other.routingKey)
        && Arrays.equals(body, other.body)
        && messageId.equals(other.messageId)
        && timestamp.equals(other.timestamp);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(exchange, routingKey, messageId, timestamp, persistent) + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "OutboundMessage[exchange=" + exchange + ", routingKey=" + routingKey
        + ", messageId=" + messageId + ", timestamp=" + timestamp + ", persistent=" + persistent
        + ", body=" + body.length + " bytes]";
  }
}
