package io.courier.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Thread-safe once constructed; the mapper must not be reconfigured afterwards.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE =
      new TypeReference<>() {
      };

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public byte[] encode(Map<String, Object> payload) {
    Objects.requireNonNull(payload, "payload");
    try {
      return mapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload is not serializable as JSON", e);
    }
  }

  @Override
  public Map<String, Object> decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new IllegalArgumentException("Empty message body");
    }
    try {
      Map<String, Object> decoded = mapper.readValue(body, PAYLOAD_TYPE);
      if (decoded == null) {
        throw new IllegalArgumentException("Expected JSON object, got null");
      }
      return decoded;
    } catch (IOException e) {
      throw new IllegalArgumentException("Message body is not a JSON object", e);
    }
  }
}
