package io.courier.util;

import java.util.Map;

/**
 * Converts event payloads to and from the UTF-8 JSON bodies carried on the wire.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) is backed by Jackson.
 * Implement this interface to plug in a pre-configured mapper or another JSON library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the shared Jackson-backed codec.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a payload as a UTF-8 JSON object.
     *
     * @param payload the payload to encode
     * @return JSON bytes
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    byte[] encode(Map<String, Object> payload);

    /**
     * Decodes a UTF-8 JSON object into a mutable, insertion-ordered map.
     *
     * @param body the message body
     * @return decoded payload (never {@code null})
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    Map<String, Object> decode(byte[] body);
}
