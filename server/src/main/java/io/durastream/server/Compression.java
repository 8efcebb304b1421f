package io.durastream.server;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Content-encoding negotiation and the gzip / deflate codec.
 * <p>
 * Negotiation rules:
 *  - Accept-Encoding is a comma separated list; each entry may carry {@code ;q=<weight>}.
 *  - A weight of exactly 0 means the encoding is refused.
 *  - gzip is preferred over deflate regardless of list order or weights.
 *  - Anything else (br, identity, *) is ignored.
 * <p>
 * "deflate" is the zlib-wrapped format, as browsers and java.net.http expect.
 */
public final class Compression {

    /** Bodies smaller than this are sent uncompressed. */
    public static final int THRESHOLD = 1024;

    public static final String GZIP = "gzip";
    public static final String DEFLATE = "deflate";

    private Compression() {
        // utility
    }

    /** Encoding to use for a response, or null for none. */
    public static String negotiate(String acceptEncoding) {
        if (acceptEncoding == null || acceptEncoding.isBlank()) {
            return null;
        }
        String[] entries = acceptEncoding.toLowerCase(Locale.ROOT).split(",");
        if (accepts(entries, GZIP)) {
            return GZIP;
        }
        if (accepts(entries, DEFLATE)) {
            return DEFLATE;
        }
        return null;
    }

    public static byte[] compress(byte[] data, String encoding) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (OutputStream out = encoder(buf, encoding)) {
            out.write(data);
        } catch (IOException e) {
            // in-memory streams only fail on programming errors
            throw new UncheckedIOException(e);
        }
        return buf.toByteArray();
    }

    /**
     * Decode a request body sent with {@code Content-Encoding}.
     * <p>
     * At most {@code maxBytes + 1} decoded bytes are produced, so a caller
     * can detect an oversized body without inflating all of it.
     *
     * @throws IOException on a corrupt body
     * @throws IllegalArgumentException for an unsupported encoding
     */
    public static byte[] decompress(byte[] data, String encoding, int maxBytes) throws IOException {
        try (InputStream in = decoder(new ByteArrayInputStream(data), encoding)) {
            return in.readNBytes(maxBytes + 1);
        }
    }

    private static boolean accepts(String[] entries, String name) {
        for (String entry : entries) {
            String[] parts = entry.split(";");
            if (parts[0].trim().equals(name) && !hasZeroWeight(parts)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasZeroWeight(String[] parts) {
        for (int i = 1; i < parts.length; i++) {
            String param = parts[i].trim();
            if (param.startsWith("q=")) {
                try {
                    return Double.parseDouble(param.substring(2).trim()) == 0.0;
                } catch (NumberFormatException e) {
                    return false;
                }
            }
        }
        return false;
    }

    private static OutputStream encoder(OutputStream sink, String encoding) throws IOException {
        return switch (normalize(encoding)) {
            case GZIP -> new GZIPOutputStream(sink);
            case DEFLATE -> new DeflaterOutputStream(sink);
            default -> throw new IllegalArgumentException("Unsupported encoding: " + encoding);
        };
    }

    private static InputStream decoder(InputStream source, String encoding) throws IOException {
        return switch (normalize(encoding)) {
            case GZIP -> new GZIPInputStream(source);
            case DEFLATE -> new InflaterInputStream(source);
            default -> throw new IllegalArgumentException("Unsupported encoding: " + encoding);
        };
    }

    private static String normalize(String encoding) {
        return encoding == null ? "" : encoding.trim().toLowerCase(Locale.ROOT);
    }
}
