package io.durastream.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.durastream.core.ContentTypes;
import io.durastream.core.JsonFraming;
import io.durastream.core.StreamMessage;
import io.durastream.server.fault.InjectedFault;
import io.durastream.storage.StoreException;
import io.durastream.storage.Subscription;
import io.durastream.storage.SubscriptionEvent;
import io.durastream.storage.SubscriptionListener;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.sse.ServerSentEventConnection;
import io.undertow.server.handlers.sse.ServerSentEventHandler;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One live-tail SSE response.
 * <p>
 * Frames:
 *   event: data     one per stored message; JSON streams as {@code [value]},
 *                   text streams as UTF-8, anything else base64
 *   event: control  {"streamNextOffset", "streamCursor", "upToDate": true}
 *                   or {"streamNextOffset", "streamClosed": true} as the last frame
 * <p>
 * Locking: store events arrive while the store holds the stream's monitor,
 * then take {@code lock}. Nothing here calls into the store while holding
 * {@code lock}, so the order is always store, then session.
 */
final class SseSession implements SubscriptionListener, PushConnection {
    private static final Logger log = Logger.getLogger(SseSession.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private static final String DATA_EVENT = "data";
    private static final String CONTROL_EVENT = "control";

    private final ServerContext ctx;
    private final String path;
    private final boolean base64;
    private final boolean jsonStream;
    private final String clientCursor;
    private final InjectedFault fault;

    private final Object lock = new Object();
    // guarded by lock
    private String currentOffset;
    private boolean sawEvent;
    private boolean finished;
    private ServerSentEventConnection connection;

    private volatile Subscription subscription;
    private volatile ScheduledFuture<?> keepAlive;

    SseSession(ServerContext ctx, String path, String contentType, String startOffset,
               String clientCursor, InjectedFault fault) {
        this.ctx = ctx;
        this.path = path;
        this.base64 = !ContentTypes.isTextCompatible(contentType);
        this.jsonStream = ContentTypes.isJson(contentType);
        this.currentOffset = startOffset;
        this.clientCursor = clientCursor;
        this.fault = fault;
    }

    void handle(HttpServerExchange ex) throws Exception {
        ex.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-cache");
        if (base64) {
            ex.getResponseHeaders().put(ProtocolHeaders.STREAM_SSE_DATA_ENCODING, "base64");
        }
        new ServerSentEventHandler((conn, lastEventId) -> start(conn)).handleRequest(ex);
    }

    private void start(ServerSentEventConnection conn) {
        String from;
        synchronized (lock) {
            connection = conn;
            from = currentOffset;
        }
        if (!ctx.track(this)) {
            closeConnection();
            return;
        }
        conn.addCloseTask(c -> stop());

        if (fault != null && fault.injectSseEvent() != null) {
            InjectedFault.SseEvent injected = fault.injectSseEvent();
            conn.send(injected.data(), injected.eventType(), null, null);
        }

        try {
            Subscription sub = ctx.store().subscribe(path, from, this);
            subscription = sub;
            if (isFinished()) {
                sub.cancel();
                return;
            }
        } catch (StoreException e) {
            log.log(Level.FINE, "SSE subscribe failed for " + path, e);
            closeConnection();
            return;
        }

        synchronized (lock) {
            if (!sawEvent && !finished) {
                sendControl(false);
            }
        }

        long period = ctx.config().longPollTimeoutMs();
        try {
            keepAlive = ctx.scheduler().scheduleWithFixedDelay(this::sendKeepAlive, period, period, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // shutting down
            closeConnection();
        }
        if (isFinished()) {
            stop();
        }
    }

    @Override
    public void onEvent(SubscriptionEvent event) {
        synchronized (lock) {
            if (finished) {
                return;
            }
            sawEvent = true;
            switch (event.type()) {
                case APPEND -> {
                    for (StreamMessage m : event.messages()) {
                        connection.send(payload(m), DATA_EVENT, null, null);
                        currentOffset = m.offset();
                    }
                    sendControl(false);
                }
                case CLOSED -> {
                    currentOffset = event.offset();
                    finished = true;
                    // close once the final control frame is on the wire
                    connection.send(controlFrame(true), CONTROL_EVENT, null, new ServerSentEventConnection.EventCallback() {
                        @Override
                        public void done(ServerSentEventConnection c, String data, String ev, String id) {
                            closeConnection();
                        }

                        @Override
                        public void failed(ServerSentEventConnection c, String data, String ev, String id, IOException e) {
                            log.log(Level.FINE, "SSE final frame not delivered on " + path, e);
                            closeConnection();
                        }
                    });
                }
                case ERROR -> {
                    finished = true;
                    closeConnection();
                }
            }
        }
    }

    @Override
    public void close() throws IOException {
        ServerSentEventConnection c;
        synchronized (lock) {
            finished = true;
            c = connection;
        }
        if (c != null) {
            c.close();
        }
    }

    private void sendKeepAlive() {
        synchronized (lock) {
            if (!finished && connection.isOpen()) {
                sendControl(false);
            }
        }
    }

    /** Runs once the connection is gone, whoever closed it. */
    private void stop() {
        synchronized (lock) {
            finished = true;
        }
        Subscription s = subscription;
        if (s != null) {
            s.cancel();
        }
        ScheduledFuture<?> k = keepAlive;
        if (k != null) {
            k.cancel(false);
        }
        ctx.untrack(this);
    }

    private boolean isFinished() {
        synchronized (lock) {
            return finished;
        }
    }

    private void closeConnection() {
        try {
            close();
        } catch (IOException e) {
            log.log(Level.FINE, "SSE connection on " + path + " already gone", e);
        }
    }

    // caller holds lock
    private void sendControl(boolean closed) {
        connection.send(controlFrame(closed), CONTROL_EVENT, null, null);
    }

    // caller holds lock
    private String controlFrame(boolean closed) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(ProtocolHeaders.SSE_OFFSET_FIELD, currentOffset);
        if (closed) {
            frame.put(ProtocolHeaders.SSE_CLOSED_FIELD, true);
        } else {
            frame.put(ProtocolHeaders.SSE_CURSOR_FIELD, ctx.cursor().next(clientCursor));
            frame.put(ProtocolHeaders.SSE_UP_TO_DATE_FIELD, true);
        }
        try {
            return JSON.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("control frame serialisation failed", e);
        }
    }

    private String payload(StreamMessage m) {
        if (base64) {
            return Base64.getEncoder().encodeToString(m.data());
        }
        if (jsonStream) {
            return JsonFraming.renderSingle(m.data());
        }
        return new String(m.data(), StandardCharsets.UTF_8);
    }
}
