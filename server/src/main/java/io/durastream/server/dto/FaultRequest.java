package io.durastream.server.dto;

import io.durastream.server.fault.InjectedFault;

/**
 * JSON body for POST /_test/inject-error.
 * Example:
 *   {
 *     "path": "/chat/1",
 *     "status": 503,
 *     "count": 2,
 *     "retryAfter": 1,
 *     "method": "POST"
 *   }
 */
public class FaultRequest {
    public String path;
    public Integer status;
    public Integer count;              // defaults to 1
    public Integer retryAfter;         // seconds
    public Long delayMs;
    public Long jitterMs;
    public Boolean dropConnection;
    public Integer truncateBodyBytes;
    public Double probability;
    public String method;
    public Boolean corruptBody;
    public SseEvent injectSseEvent;

    public static class SseEvent {
        public String eventType;
        public String data;
    }

    /**
     * @throws IllegalArgumentException if {@code path} is missing or no fault type is given
     */
    public InjectedFault toFault() {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Missing required field: path");
        }
        InjectedFault.SseEvent sse = null;
        if (injectSseEvent != null) {
            if (injectSseEvent.eventType == null || injectSseEvent.data == null) {
                throw new IllegalArgumentException("injectSseEvent requires eventType and data");
            }
            sse = new InjectedFault.SseEvent(injectSseEvent.eventType, injectSseEvent.data);
        }
        return new InjectedFault(
                status,
                count == null ? 1 : count,
                retryAfter,
                delayMs,
                jitterMs,
                Boolean.TRUE.equals(dropConnection),
                truncateBodyBytes,
                probability,
                method,
                Boolean.TRUE.equals(corruptBody),
                sse
        );
    }
}
