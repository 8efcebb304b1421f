package io.durastream.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Storage framing for JSON-mode streams.
 * <p>
 * Stored form: a sequence of comma-terminated JSON values, e.g.
 * {@code {"a":1},{"a":2},}. An append body that is a top-level array is
 * flattened into its elements; any other value is stored byte-for-byte with a
 * comma appended.
 * <p>
 * Read form: the stored values wrapped into one JSON array, {@code [v1,v2]}.
 */
public final class JsonFraming {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final byte[] EMPTY_ARRAY = "[]".getBytes(StandardCharsets.US_ASCII);

    private JsonFraming() {
        // utility
    }

    /**
     * Validate and normalise an append body.
     *
     * @param data           raw request body
     * @param initialCreate  true when the body is the initial data of a create;
     *                       an empty array is then allowed and yields no bytes
     * @return comma-terminated bytes to store (empty only for an initial empty array)
     * @throws IllegalArgumentException if the body is not JSON, or is an empty array on append
     */
    public static byte[] normalizeAppend(byte[] data, boolean initialCreate) {
        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(data);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON", e);
        }
        if (parsed == null || parsed.isMissingNode()) {
            throw new IllegalArgumentException("Invalid JSON");
        }

        if (parsed.isArray()) {
            if (parsed.isEmpty()) {
                if (initialCreate) {
                    return new byte[0];
                }
                throw new IllegalArgumentException("Empty arrays are not allowed");
            }
            StringBuilder sb = new StringBuilder();
            for (JsonNode element : parsed) {
                try {
                    sb.append(MAPPER.writeValueAsString(element)).append(',');
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("re-serialising parsed JSON failed", e);
                }
            }
            return sb.toString().getBytes(StandardCharsets.UTF_8);
        }

        // Keep the client's formatting for single values.
        byte[] out = new byte[data.length + 1];
        System.arraycopy(data, 0, out, 0, data.length);
        out[data.length] = ',';
        return out;
    }

    /**
     * Index just past the last meaningful byte: trailing ASCII whitespace
     * (space, LF, CR, tab) is skipped, then one trailing comma.
     */
    public static int contentEnd(byte[] data) {
        int end = data.length;
        while (end > 0 && isTrailingWhitespace(data[end - 1])) {
            end--;
        }
        if (end > 0 && data[end - 1] == ',') {
            end--;
        }
        return end;
    }

    /** One stored message as a JSON array string, used for SSE data frames. */
    public static String renderSingle(byte[] data) {
        return "[" + new String(data, 0, contentEnd(data), StandardCharsets.UTF_8) + "]";
    }

    /** Several stored messages as one JSON array. */
    public static byte[] renderArray(List<StreamMessage> messages) {
        if (messages.isEmpty()) {
            return EMPTY_ARRAY.clone();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write('[');
        for (StreamMessage m : messages) {
            out.write(m.data(), 0, m.data().length);
        }
        byte[] buf = out.toByteArray();
        int end = contentEnd(buf);
        byte[] result = new byte[end + 1];
        System.arraycopy(buf, 0, result, 0, end);
        result[end] = ']';
        return result;
    }

    /** Response body for a read: JSON array for JSON streams, concatenated bytes otherwise. */
    public static byte[] render(String contentType, List<StreamMessage> messages) {
        if (ContentTypes.isJson(contentType)) {
            return renderArray(messages);
        }
        int total = 0;
        for (StreamMessage m : messages) {
            total += m.size();
        }
        byte[] out = new byte[total];
        int pos = 0;
        for (StreamMessage m : messages) {
            System.arraycopy(m.data(), 0, out, pos, m.size());
            pos += m.size();
        }
        return out;
    }

    private static boolean isTrailingWhitespace(byte b) {
        return b == ' ' || b == '\n' || b == '\r' || b == '\t';
    }
}
