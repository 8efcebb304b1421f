package io.durastream.core.decode;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural constraint over a Jackson tree.
 * <p>
 * Implementations append every violation they find to {@code out} instead of
 * stopping at the first, so callers can report all broken fields at once.
 * Built-in schemas live in {@link Schemas}.
 */
@FunctionalInterface
public interface MessageSchema {

    /**
     * Check {@code value} (located at {@code path}) and collect violations.
     *
     * @param value the node to check; never null, may be a NullNode
     */
    void validate(JsonNode value, String path, List<SchemaViolation> out);

    /** Validate a root value; an empty list means success. */
    default List<SchemaViolation> validate(JsonNode value) {
        List<SchemaViolation> out = new ArrayList<>();
        validate(value, "", out);
        return out;
    }
}
