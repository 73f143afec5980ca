package org.irradcontrol.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON codec for every payload exchanged on the four channels. One message is one line of
 * UTF-8 text.
 */
public final class MessageCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private MessageCodec() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes a message to a single line of JSON.
     *
     * @throws ProtocolException if the value cannot be serialized.
     */
    public static String encode(final Object message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses a message of the given type.
     *
     * @throws ProtocolException if the text is not valid JSON for {@code type}.
     */
    public static <T> T decode(final String json, final Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed " + type.getSimpleName() + " message: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T convert(final JsonNode node, final Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Cannot convert payload to " + type.getSimpleName(), e);
        }
    }

    public static JsonNode toTree(final Object value) {
        return MAPPER.valueToTree(value);
    }
}
