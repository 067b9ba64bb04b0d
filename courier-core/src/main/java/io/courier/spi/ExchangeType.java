package io.courier.spi;

/**
 * AMQP exchange types.
 */
public enum ExchangeType {
  DIRECT("direct"),
  FANOUT("fanout"),
  TOPIC("topic"),
  HEADERS("headers");

  private final String wireName;

  ExchangeType(String wireName) {
    this.wireName = wireName;
  }

  /** Name used on the wire, e.g. {@code "topic"}. */
  public String wireName() {
    return wireName;
  }
}
