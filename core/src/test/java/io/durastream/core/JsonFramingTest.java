package io.durastream.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFramingTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String str(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void single_value_keeps_formatting_and_gets_comma() {
        assertEquals("{ \"a\": 1 },", str(JsonFraming.normalizeAppend(utf8("{ \"a\": 1 }"), false)));
    }

    @Test
    void array_is_flattened_into_elements() {
        assertEquals("{\"a\":1},2,\"x\",", str(JsonFraming.normalizeAppend(utf8("[{\"a\": 1}, 2, \"x\"]"), false)));
    }

    @Test
    void empty_array_is_rejected_on_append_but_allowed_on_create() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JsonFraming.normalizeAppend(utf8("[]"), false));
        assertTrue(e.getMessage().contains("Empty arrays"));
        assertEquals(0, JsonFraming.normalizeAppend(utf8("[]"), true).length);
    }

    @Test
    void invalid_json_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonFraming.normalizeAppend(utf8("{nope"), false));
        assertThrows(IllegalArgumentException.class, () -> JsonFraming.normalizeAppend(utf8("   "), false));
        assertThrows(IllegalArgumentException.class, () -> JsonFraming.normalizeAppend(utf8("1 2"), false));
    }

    @Test
    void render_array_wraps_stored_values() {
        List<StreamMessage> msgs = List.of(
                new StreamMessage(utf8("{\"a\":1},"), "0_1", 0L),
                new StreamMessage(utf8("{\"a\":2},\n"), "0_2", 0L)
        );
        assertEquals("[{\"a\":1},{\"a\":2}]", str(JsonFraming.render("application/json; charset=utf-8", msgs)));
        assertEquals("[]", str(JsonFraming.render(ContentTypes.JSON, List.of())));
    }

    @Test
    void binary_render_concatenates_payloads() {
        List<StreamMessage> msgs = List.of(
                new StreamMessage(utf8("ab"), "0_2", 0L),
                new StreamMessage(utf8("cd"), "0_4", 0L)
        );
        assertEquals("abcd", str(JsonFraming.render("text/plain", msgs)));
    }

    @Test
    void render_single_strips_terminator() {
        assertEquals("[{\"k\":true}]", JsonFraming.renderSingle(utf8("{\"k\":true}, \r\n")));
    }
}
