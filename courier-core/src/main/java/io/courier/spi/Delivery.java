package io.courier.spi;

import java.util.Arrays;
import java.util.Objects;

/**
 * A message received from a queue and not yet acknowledged. Equality compares the body by
 * content.
 *
 * @param deliveryTag  channel-scoped tag used to ack or nack
 * @param body         raw message body
 * @param messageId    publisher-assigned id, or {@code null} if the publisher set none
 * @param redelivered  whether the broker has delivered this message before
 */
public record Delivery(long deliveryTag, byte[] body, String messageId, boolean redelivered) {

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Delivery other)) {
      return false;
    }
    return deliveryTag == other.deliveryTag
        && redelivered == other.redelivered
        && Arrays.equals(body, other.body)
        && Objects.equals(messageId, other.messageId);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(deliveryTag, messageId, redelivered) + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "Delivery[deliveryTag=" + deliveryTag + ", messageId=" + messageId
        + ", redelivered=" + redelivered + ", body=" + (body == null ? "null" : body.length + " bytes") + "]";
  }
}
