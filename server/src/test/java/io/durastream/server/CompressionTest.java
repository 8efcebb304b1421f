package io.durastream.server;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CompressionTest {

    @Test
    void prefers_gzip_over_deflate() {
        assertEquals(Compression.GZIP, Compression.negotiate("deflate, gzip"));
        assertEquals(Compression.DEFLATE, Compression.negotiate("deflate"));
    }

    @Test
    void zero_weight_refuses_an_encoding() {
        assertEquals(Compression.DEFLATE, Compression.negotiate("gzip;q=0, deflate"));
        assertNull(Compression.negotiate("gzip;q=0"));
    }

    @Test
    void unknown_or_missing_header_means_no_compression() {
        assertNull(Compression.negotiate("br"));
        assertNull(Compression.negotiate(null));
        assertNull(Compression.negotiate(""));
    }

    @Test
    void compressed_body_decodes_to_original() throws Exception {
        byte[] data = "stream payload ".repeat(200).getBytes(StandardCharsets.UTF_8);
        for (String enc : new String[]{Compression.GZIP, Compression.DEFLATE}) {
            byte[] packed = Compression.compress(data, enc);
            assertTrue(packed.length < data.length, enc);
            assertArrayEquals(data, Compression.decompress(packed, enc, 1 << 20), enc);
        }
    }

    @Test
    void unsupported_request_encoding_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Compression.decompress(new byte[]{1}, "br", 16));
    }

    @Test
    void decoding_stops_one_byte_past_the_limit() throws Exception {
        byte[] packed = Compression.compress(new byte[1 << 20], Compression.GZIP);
        assertEquals(1025, Compression.decompress(packed, Compression.GZIP, 1024).length);
    }
}
