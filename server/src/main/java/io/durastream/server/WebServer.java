package io.durastream.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.durastream.server.dto.FaultRequest;
import io.durastream.server.fault.InjectedFault;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.SameThreadExecutor;

import java.io.IOException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thin HTTP adapter over the stream store.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Consult the fault injector before a stream request is handled.
 *  - Hand stream requests to {@link ReadHandler} / {@link WriteHandler}.
 *  - Map exceptions to HTTP status codes.
 *  - Emit per-request logging once the exchange completes.
 *
 * Path layout:
 *   - PUT     /{path}               create stream
 *   - POST    /{path}               append / close / strict create
 *   - GET     /{path}?offset=..     catch-up, long-poll or SSE read
 *   - HEAD    /{path}               metadata
 *   - DELETE  /{path}               delete stream
 *   - OPTIONS *                     CORS preflight
 *   - POST    /_test/inject-error   install a fault (JSON body, see {@link FaultRequest})
 *   - DELETE  /_test/inject-error   clear all faults
 */
public final class WebServer {
    private static final Logger log = Logger.getLogger(WebServer.class.getName());

    static final String FAULT_PATH = "/_test/inject-error";
    private static final HttpString RETRY_AFTER = new HttpString("Retry-After");

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ServerContext ctx;
    private final ReadHandler reads;
    private final WriteHandler writes;

    public WebServer(int port, ServerContext ctx) {
        this.ctx = ctx;
        this.reads = new ReadHandler(ctx);
        this.writes = new WriteHandler(ctx);

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    long start = System.nanoTime();
                    exchange.addExchangeCompleteListener((ex, next) -> {
                        logCompleted(ex, start);
                        next.proceed();
                    });
                    ProtocolHeaders.applyDefaults(exchange.getResponseHeaders());
                    try {
                        route(exchange);
                    } catch (Exception e) {
                        Exchanges.sendFailure(exchange, e);
                    }
                }).build();
    }

    public void start() {
        server.start();
        log.info(() -> "Stream server started on port " + ctx.config().port());
    }

    /** Close live connections first so no exchange is left waiting on a stopped server. */
    public void stop() {
        ctx.shutdown();
        server.stop();
    }

    public ServerContext context() {
        return ctx;
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) throws Exception {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();

        if ("OPTIONS".equals(method)) {
            Exchanges.sendEmpty(ex, 204);
            return;
        }
        if (FAULT_PATH.equals(path)) {
            handleFaultControl(ex, method);
            return;
        }

        InjectedFault fault = ctx.faults().consume(path, method);
        if (fault == null) {
            handleStream(ex, method, path, null);
            return;
        }
        ex.putAttachment(Exchanges.FAULTED, Boolean.TRUE);
        long delay = ctx.faults().delayMillis(fault);
        if (delay <= 0) {
            applyFault(ex, method, path, fault);
            return;
        }
        // park the exchange without a thread; a worker picks it up once the delay has elapsed
        ex.dispatch(SameThreadExecutor.INSTANCE, () -> {
            try {
                ctx.scheduler().schedule(() -> ex.dispatch(() -> {
                    try {
                        applyFault(ex, method, path, fault);
                    } catch (Exception e) {
                        Exchanges.sendFailure(ex, e);
                    }
                }), delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                Exchanges.sendText(ex, 503, "Server shutting down");
            }
        });
    }

    private void applyFault(HttpServerExchange ex, String method, String path, InjectedFault fault) throws Exception {
        if (fault.dropConnection()) {
            dropConnection(ex, path);
            return;
        }
        if (fault.status() != null) {
            if (fault.retryAfter() != null) {
                ex.getResponseHeaders().put(RETRY_AFTER, fault.retryAfter().toString());
            }
            Exchanges.sendText(ex, fault.status(), "Injected error for testing");
            return;
        }
        handleStream(ex, method, path, fault.affectsBody() ? fault : null);
    }

    private void handleStream(HttpServerExchange ex, String method, String path, InjectedFault bodyFault)
            throws Exception {
        switch (method) {
            case "PUT" -> writes.handlePut(ex, path);
            case "POST" -> writes.handlePost(ex, path);
            case "GET" -> reads.handleGet(ex, path, bodyFault);
            case "HEAD" -> reads.handleHead(ex, path);
            case "DELETE" -> handleDelete(ex, path);
            default -> Exchanges.sendText(ex, 405, "Method not allowed");
        }
    }

    /** DELETE /{path} */
    private void handleDelete(HttpServerExchange ex, String path) {
        boolean deleted = Exchanges.timed(ex, () -> ctx.store().delete(path));
        if (deleted) {
            Exchanges.sendEmpty(ex, 204);
        } else {
            Exchanges.sendText(ex, 404, "Stream not found");
        }
    }

    /** POST/DELETE /_test/inject-error */
    private void handleFaultControl(HttpServerExchange ex, String method) {
        switch (method) {
            case "POST" -> ex.getRequestReceiver().receiveFullBytes((exchange, data) -> {
                try {
                    var req = json.readValue(data, FaultRequest.class);
                    ctx.faults().install(req.path, req.toFault());
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    exchange.getResponseSender().send("{\"ok\":true}");
                } catch (JsonProcessingException bad) {
                    Exchanges.sendText(exchange, 400, "Invalid JSON body");
                } catch (IOException | RuntimeException e) {
                    Exchanges.sendFailure(exchange, e);
                }
            }, Exchanges::sendFailure);
            case "DELETE" -> {
                ctx.faults().clear();
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                ex.getResponseSender().send("{\"ok\":true}");
            }
            default -> Exchanges.sendText(ex, 405, "Method not allowed");
        }
    }

    private static void dropConnection(HttpServerExchange ex, String path) {
        log.info(() -> "Injected fault: dropping connection for " + path);
        try {
            ex.getConnection().close();
        } catch (IOException e) {
            log.log(Level.FINE, "Connection already closed for " + path, e);
        }
    }

    private static void logCompleted(HttpServerExchange ex, long startNanos) {
        long totalMs = (System.nanoTime() - startNanos) / 1_000_000L;
        Long storeNanos = ex.getAttachment(Exchanges.STORE_NANOS);
        String live = Exchanges.query(ex, ProtocolHeaders.LIVE_PARAM);
        boolean liveRead = "GET".equals(ex.getRequestMethod().toString())
                && (ProtocolHeaders.LIVE_LONG_POLL.equals(live) || ProtocolHeaders.LIVE_SSE.equals(live));
        RequestLogger.logRequest(new RequestLogger.Entry(
                ex.getRequestMethod().toString(),
                ex.getRequestPath(),
                liveRead ? live : null,
                ex.getStatusCode(),
                totalMs,
                storeNanos == null ? -1L : storeNanos / 1_000_000L,
                "true".equals(ex.getResponseHeaders().getFirst(ProtocolHeaders.STREAM_CLOSED)),
                ex.getAttachment(Exchanges.FAULTED) != null,
                ex.getAttachment(Exchanges.FAILURE)
        ));
    }
}
