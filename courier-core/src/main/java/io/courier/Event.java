package io.courier;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable event headed for (or received from) the broker.
 *
 * <p>The payload is the JSON body sent on the wire. Three well-known fields are
 * injected by {@link #withDefaults(Clock)} only when absent: {@value #TIMESTAMP}
 * (ISO-8601), {@value #TRACE_ID} (8 lowercase hex characters) and {@value #EVENT_TYPE}
 * (the routing key). Fields supplied by the caller are never overwritten, so an event
 * that is requeued keeps its original values.
 *
 * <p>Each event also carries a {@link #messageId()} that stays the same across requeues
 * and is sent as the broker message id.
 */
public final class Event {
  public static final String TIMESTAMP = "timestamp";
  public static final String TRACE_ID = "trace_id";
  public static final String EVENT_TYPE = "event_type";

  private final String exchange;
  private final String routingKey;
  private final Map<String, Object> payload;
  private final String messageId;

  private Event(String exchange, String routingKey, Map<String, Object> payload, String messageId) {
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.payload = payload;
    this.messageId = messageId;
  }

  /**
   * Creates an event with a defensive copy of {@code payload}.
   *
   * @throws NullPointerException if any argument is null
   * @throws IllegalArgumentException if {@code exchange} is empty or the payload has a null key
   */
  public static Event of(String exchange, String routingKey, Map<String, ?> payload) {
    Objects.requireNonNull(exchange, "exchange");
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(payload, "payload");
    if (exchange.isEmpty()) {
      throw new IllegalArgumentException("exchange must not be empty");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : payload.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("payload cannot contain null keys");
      }
      copy.put(entry.getKey(), entry.getValue());
    }
    return new Event(exchange, routingKey, Collections.unmodifiableMap(copy), UUID.randomUUID().toString());
  }

  /**
   * Returns an event whose payload has {@value #TIMESTAMP}, {@value #TRACE_ID} and
   * {@value #EVENT_TYPE} set, filling only the missing ones. Returns {@code this} when
   * nothing is missing.
   */
  public Event withDefaults(Clock clock) {
    boolean complete = payload.get(TIMESTAMP) != null
        && payload.get(TRACE_ID) != null
        && payload.get(EVENT_TYPE) != null;
    if (complete) {
      return this;
    }
    Map<String, Object> filled = new LinkedHashMap<>(payload);
    if (filled.get(TIMESTAMP) == null) {
      filled.put(TIMESTAMP, Instant.now(clock).toString());
    }
    if (filled.get(TRACE_ID) == null) {
      filled.put(TRACE_ID, newTraceId());
    }
    if (filled.get(EVENT_TYPE) == null) {
      filled.put(EVENT_TYPE, routingKey);
    }
    return new Event(exchange, routingKey, Collections.unmodifiableMap(filled), messageId);
  }

  static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
  }

  public String exchange() {
    return exchange;
  }

  public String routingKey() {
    return routingKey;
  }

  /** Unmodifiable, insertion-ordered payload. */
  public Map<String, Object> payload() {
    return payload;
  }

  public String messageId() {
    return messageId;
  }

  public String timestamp() {
    Object value = payload.get(TIMESTAMP);
    return value == null ? null : value.toString();
  }

  public String traceId() {
    Object value = payload.get(TRACE_ID);
    return value == null ? null : value.toString();
  }

  public String eventType() {
    Object value = payload.get(EVENT_TYPE);
    return value == null ? null : value.toString();
  }

  @Override
  public String toString() {
    return "Event{exchange=" + exchange + ", routingKey=" + routingKey
        + ", messageId=" + messageId + ", traceId=" + traceId() + "}";
  }
}
