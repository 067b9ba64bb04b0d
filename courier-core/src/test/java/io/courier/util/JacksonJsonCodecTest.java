package io.courier.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JacksonJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void nestedPayloadSurvivesEncoding() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", 42);
        payload.put("roles", List.of("admin", "user"));
        payload.put("profile", Map.of("email", "a@example.com"));

        Map<String, Object> decoded = codec.decode(codec.encode(payload));

        assertEquals(42, decoded.get("user_id"));
        assertEquals(List.of("admin", "user"), decoded.get("roles"));
        assertEquals(Map.of("email", "a@example.com"), decoded.get("profile"));
    }

    @Test
    void decodePreservesFieldOrder() {
        Map<String, Object> decoded = codec.decode(bytes("{\"b\":1,\"a\":2,\"c\":3}"));

        assertEquals(List.of("b", "a", "c"), List.copyOf(decoded.keySet()));
    }

    @Test
    void decodeRejectsEmptyBody() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    void decodeRejectsMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes("{not json")));
    }

    @Test
    void decodeRejectsNonObjectJson() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes("[1,2,3]")));
        assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes("null")));
    }

    @Test
    void encodeRejectsUnserializableValue() {
        Map<String, Object> payload = Map.of("self", new Object());

        assertThrows(IllegalArgumentException.class, () -> codec.encode(payload));
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
