package io.durastream.server.fault;

/**
 * A configured, self-expiring failure for one stream path.
 *
 * @param status             status code to answer with instead of handling the request
 * @param count              number of matching requests it applies to
 * @param retryAfter         Retry-After seconds sent with {@code status}
 * @param delayMs            delay before the request is handled
 * @param jitterMs           extra random delay in [0, jitterMs)
 * @param dropConnection     close the connection without a response
 * @param truncateBodyBytes  cut GET bodies to this many bytes
 * @param probability        chance in [0, 1] that a matching request is affected (null = always)
 * @param method             only requests with this method are affected (null = any)
 * @param corruptBody        overwrite bytes of GET bodies
 * @param injectSseEvent     extra frame written at the start of an SSE response
 */
public record InjectedFault(
        Integer status,
        int count,
        Integer retryAfter,
        Long delayMs,
        Long jitterMs,
        boolean dropConnection,
        Integer truncateBodyBytes,
        Double probability,
        String method,
        boolean corruptBody,
        SseEvent injectSseEvent
) {

    /** Raw SSE frame injected ahead of the real events. */
    public record SseEvent(String eventType, String data) {
    }

    public InjectedFault {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        if (probability != null && (probability < 0.0 || probability > 1.0)) {
            throw new IllegalArgumentException("probability must be in [0, 1]");
        }
        if (!hasEffect(status, delayMs, dropConnection, truncateBodyBytes, corruptBody, injectSseEvent)) {
            throw new IllegalArgumentException(
                    "Must specify at least one fault type: status, delayMs, dropConnection, "
                            + "truncateBodyBytes, corruptBody, or injectSseEvent");
        }
    }

    /** Fault that answers {@code status} once. */
    public static InjectedFault status(int status) {
        return new InjectedFault(status, 1, null, null, null, false, null, null, null, false, null);
    }

    public InjectedFault withCount(int n) {
        return new InjectedFault(status, n, retryAfter, delayMs, jitterMs, dropConnection,
                truncateBodyBytes, probability, method, corruptBody, injectSseEvent);
    }

    public InjectedFault withMethod(String m) {
        return new InjectedFault(status, count, retryAfter, delayMs, jitterMs, dropConnection,
                truncateBodyBytes, probability, m, corruptBody, injectSseEvent);
    }

    public InjectedFault withProbability(double p) {
        return new InjectedFault(status, count, retryAfter, delayMs, jitterMs, dropConnection,
                truncateBodyBytes, p, method, corruptBody, injectSseEvent);
    }

    /** True when the fault changes the response body rather than replacing the response. */
    public boolean affectsBody() {
        return truncateBodyBytes != null || corruptBody || injectSseEvent != null;
    }

    private static boolean hasEffect(Integer status, Long delayMs, boolean drop, Integer truncate,
                                     boolean corrupt, SseEvent sse) {
        return status != null || delayMs != null || drop || truncate != null || corrupt || sse != null;
    }
}
