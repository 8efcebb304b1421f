package io.durastream.core.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.durastream.core.JsonFraming;
import io.durastream.core.StreamMessage;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Consumer-side decoding of JSON stream messages.
 * <p>
 * Steps:
 *  1) trim trailing ASCII whitespace, then one trailing comma (stored framing);
 *  2) parse the remainder as JSON;
 *  3) validate against the caller's schema, reporting every violation.
 */
public final class MessageDecoder {

    private final ObjectMapper mapper;

    public MessageDecoder() {
        this(new ObjectMapper());
    }

    public MessageDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public JsonNode decode(StreamMessage message, MessageSchema schema) {
        return decode(message.data(), schema);
    }

    /**
     * @throws IllegalArgumentException   if the payload is not JSON
     * @throws MessageValidationException if the value violates {@code schema}
     */
    public JsonNode decode(byte[] data, MessageSchema schema) {
        Objects.requireNonNull(schema, "schema");
        int end = JsonFraming.contentEnd(data);

        JsonNode node;
        try {
            node = mapper.readTree(data, 0, end);
        } catch (IOException e) {
            throw new IllegalArgumentException("Stream message is not valid JSON", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new IllegalArgumentException("Stream message is empty");
        }

        List<SchemaViolation> violations = schema.validate(node);
        if (!violations.isEmpty()) {
            throw new MessageValidationException(violations);
        }
        return node;
    }

    /** Decode, validate, then bind to {@code type} with Jackson. */
    public <T> T decode(StreamMessage message, MessageSchema schema, Class<T> type) {
        JsonNode node = decode(message, schema);
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot bind stream message to " + type.getSimpleName(), e);
        }
    }
}
