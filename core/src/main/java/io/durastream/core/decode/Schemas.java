package io.durastream.core.decode;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Factory for the schemas consumers use to check decoded messages.
 *
 * Example:
 * <pre>
 *   MessageSchema chat = Schemas.object()
 *       .required("role", Schemas.oneOf("user", "assistant"))
 *       .required("content", Schemas.string())
 *       .optional("ts", Schemas.integer());
 * </pre>
 */
public final class Schemas {

    private Schemas() {
        // utility
    }

    public static MessageSchema any() {
        return (value, path, out) -> { };
    }

    public static MessageSchema string() {
        return typed("string", JsonNode::isTextual);
    }

    public static MessageSchema number() {
        return typed("number", JsonNode::isNumber);
    }

    public static MessageSchema integer() {
        return typed("integer", JsonNode::isIntegralNumber);
    }

    public static MessageSchema bool() {
        return typed("boolean", JsonNode::isBoolean);
    }

    /** String restricted to the given literals. */
    public static MessageSchema oneOf(String... allowed) {
        Set<String> set = Set.of(allowed);
        return (value, path, out) -> {
            if (!value.isTextual()) {
                out.add(new SchemaViolation(path, "expected string but received " + describe(value)));
            } else if (!set.contains(value.textValue())) {
                out.add(new SchemaViolation(path, "expected one of " + List.of(allowed)
                        + " but received \"" + value.textValue() + "\""));
            }
        };
    }

    /** Array whose every element satisfies {@code element}. */
    public static MessageSchema arrayOf(MessageSchema element) {
        return (value, path, out) -> {
            if (!value.isArray()) {
                out.add(new SchemaViolation(path, "expected array but received " + describe(value)));
                return;
            }
            for (int i = 0; i < value.size(); i++) {
                element.validate(value.get(i), child(path, Integer.toString(i)), out);
            }
        };
    }

    public static ObjectSchema object() {
        return new ObjectSchema();
    }

    /** Object schema with named fields. Unknown fields are allowed. */
    public static final class ObjectSchema implements MessageSchema {
        private final Map<String, MessageSchema> required = new LinkedHashMap<>();
        private final Map<String, MessageSchema> optional = new LinkedHashMap<>();

        private ObjectSchema() {
        }

        public ObjectSchema required(String field, MessageSchema schema) {
            required.put(field, schema);
            return this;
        }

        /** Field may be absent or null; when present it must satisfy {@code schema}. */
        public ObjectSchema optional(String field, MessageSchema schema) {
            optional.put(field, schema);
            return this;
        }

        @Override
        public void validate(JsonNode value, String path, List<SchemaViolation> out) {
            if (!value.isObject()) {
                out.add(new SchemaViolation(path, "expected object but received " + describe(value)));
                return;
            }
            for (Map.Entry<String, MessageSchema> e : required.entrySet()) {
                JsonNode field = value.get(e.getKey());
                String fieldPath = child(path, e.getKey());
                if (field == null) {
                    out.add(new SchemaViolation(fieldPath, "missing required field"));
                } else {
                    e.getValue().validate(field, fieldPath, out);
                }
            }
            for (Map.Entry<String, MessageSchema> e : optional.entrySet()) {
                JsonNode field = value.get(e.getKey());
                if (field != null && !field.isNull()) {
                    e.getValue().validate(field, child(path, e.getKey()), out);
                }
            }
        }
    }

    // ---------- helpers ----------

    private interface NodeTest {
        boolean test(JsonNode node);
    }

    private static MessageSchema typed(String expected, NodeTest test) {
        return (value, path, out) -> {
            if (!test.test(value)) {
                out.add(new SchemaViolation(path, "expected " + expected + " but received " + describe(value)));
            }
        };
    }

    private static String child(String parent, String key) {
        return parent.isEmpty() ? key : parent + "." + key;
    }

    private static String describe(JsonNode value) {
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
