package io.durastream.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the stream protocol.
 *
 * One line per completed exchange:
 * <pre>
 *   HTTP GET /chat/1 [long-poll] -> 204 (total=30012ms, store=0ms) closed fault
 * </pre>
 * The bracketed live mode appears only for long-poll / SSE reads; {@code closed}
 * when the response carried {@code Stream-Closed: true}; {@code fault} when an
 * injected fault was applied to the request.
 * <p>
 * 5xx are logged at WARNING (with the exception when there is one). Live reads
 * ending normally are logged at FINE, since a tailing client produces one
 * line per poll.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /** What the logger needs from one finished exchange. */
    public record Entry(
            String method,
            String path,
            String liveMode,      // null for plain requests
            int status,
            long totalMillis,     // for live reads: including the wait
            long storeMillis,     // -1 if not measured
            boolean streamClosed,
            boolean faultInjected,
            Throwable error       // null if none
    ) {
    }

    public static void logRequest(Entry e) {
        String msg = format(e);
        if (e.status() >= 500) {
            if (e.error() != null) {
                log.log(Level.WARNING, msg, e.error());
            } else {
                log.log(Level.WARNING, msg);
            }
        } else if (e.liveMode() != null) {
            log.log(Level.FINE, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    static String format(Entry e) {
        StringBuilder sb = new StringBuilder("HTTP ")
                .append(e.method()).append(' ').append(e.path());
        if (e.liveMode() != null) {
            sb.append(" [").append(e.liveMode()).append(']');
        }
        sb.append(" -> ").append(e.status())
                .append(" (total=").append(e.totalMillis()).append("ms");
        if (e.storeMillis() >= 0) {
            sb.append(", store=").append(e.storeMillis()).append("ms");
        }
        sb.append(')');
        if (e.streamClosed()) {
            sb.append(" closed");
        }
        if (e.faultInjected()) {
            sb.append(" fault");
        }
        return sb.toString();
    }
}
