package io.durastream.core;

import java.util.Locale;

/** Content-type helpers shared by the store and the protocol layer. */
public final class ContentTypes {

    public static final String JSON = "application/json";
    public static final String OCTET_STREAM = "application/octet-stream";

    private ContentTypes() {
        // utility
    }

    /** Media type without parameters, lower-cased; "" for null. */
    public static String normalize(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isJson(String contentType) {
        return JSON.equals(normalize(contentType));
    }

    /** Payloads of these types can travel inside SSE frames without base64. */
    public static boolean isTextCompatible(String contentType) {
        String ct = normalize(contentType);
        return ct.startsWith("text/") || JSON.equals(ct);
    }
}
