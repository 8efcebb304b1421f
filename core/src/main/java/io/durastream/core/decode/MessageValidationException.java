package io.durastream.core.decode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a decoded stream message does not satisfy its schema.
 * The message lists every violation, not only the first one.
 */
public class MessageValidationException extends RuntimeException {

    private final List<SchemaViolation> violations;

    public MessageValidationException(List<SchemaViolation> violations) {
        super("Stream message failed schema validation: " + join(violations));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> violations() {
        return violations;
    }

    private static String join(List<SchemaViolation> violations) {
        return violations.stream().map(SchemaViolation::toString).collect(Collectors.joining(", "));
    }
}
