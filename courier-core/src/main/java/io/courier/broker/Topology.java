package io.courier.broker;

import io.courier.spi.BrokerChannel;
import io.courier.spi.BrokerConnection;
import io.courier.spi.ExchangeType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The set of exchanges every pooled connection declares right after the handshake.
 * Declaration is idempotent, so it is safe to repeat on every new connection.
 */
public final class Topology {
  public static final String USER_EVENTS = "user_events";
  public static final String ORDER_EVENTS = "order_events";
  public static final String SYSTEM_EVENTS = "system_events";

  private final List<ExchangeDeclaration> exchanges;

  private Topology(List<ExchangeDeclaration> exchanges) {
    this.exchanges = Collections.unmodifiableList(new ArrayList<>(exchanges));
  }

  /**
   * Durable topic exchanges {@code user_events}, {@code order_events} and
   * {@code system_events}.
   */
  public static Topology defaults() {
    return builder()
        .durableTopic(USER_EVENTS)
        .durableTopic(ORDER_EVENTS)
        .durableTopic(SYSTEM_EVENTS)
        .build();
  }

  public static Topology empty() {
    return new Topology(List.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<ExchangeDeclaration> exchanges() {
    return exchanges;
  }

  /**
   * Declares every exchange on a short-lived channel of {@code connection}.
   *
   * @param connection an open connection
   * @throws IOException if any declaration fails
   */
  public void declareOn(BrokerConnection connection) throws IOException {
    if (exchanges.isEmpty()) {
      return;
    }
    try (BrokerChannel channel = connection.openChannel()) {
      for (ExchangeDeclaration exchange : exchanges) {
        channel.declareExchange(exchange.name(), exchange.type(), exchange.durable());
      }
    }
  }

  /** One exchange to declare. */
  public record ExchangeDeclaration(String name, ExchangeType type, boolean durable) {
    public ExchangeDeclaration {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("exchange name must not be empty");
      }
    }
  }

  /** Builder for {@link Topology}. */
  public static final class Builder {
    private final List<ExchangeDeclaration> exchanges = new ArrayList<>();

    private Builder() {}

    public Builder exchange(String name, ExchangeType type, boolean durable) {
      exchanges.add(new ExchangeDeclaration(name, type, durable));
      return this;
    }

    public Builder durableTopic(String name) {
      return exchange(name, ExchangeType.TOPIC, true);
    }

    public Topology build() {
      return new Topology(exchanges);
    }
  }
}
