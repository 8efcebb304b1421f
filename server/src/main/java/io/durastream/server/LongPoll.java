package io.durastream.server;

import io.durastream.server.fault.InjectedFault;
import io.durastream.storage.StoreException;
import io.durastream.storage.StreamMetadata;
import io.durastream.storage.Subscription;
import io.durastream.storage.SubscriptionEvent;
import io.durastream.storage.SubscriptionListener;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.SameThreadExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A caught-up long-poll GET parked until the stream changes or the timeout fires.
 * <p>
 * The exchange is dispatched without an executor, so no worker thread is held
 * while waiting. Exactly one of (subscription event, timeout, shutdown) wins
 * the {@code settled} flag; the winner releases the other and writes the
 * response on the exchange's I/O thread.
 * <p>
 * Outcomes:
 *   - new messages        -> 200 with those messages
 *   - stream closed       -> 204, Stream-Closed
 *   - timeout / shutdown  -> 204, Stream-Up-To-Date (and Stream-Closed if it closed meanwhile)
 */
final class LongPoll implements SubscriptionListener {
    private static final Logger log = Logger.getLogger(LongPoll.class.getName());

    private final ServerContext ctx;
    private final ReadHandler reads;
    private final HttpServerExchange exchange;
    private final String path;
    private final String contentType;
    private final String waitOffset;
    private final String etagStart;
    private final String clientCursor;
    private final InjectedFault bodyFault;

    private final AtomicBoolean settled = new AtomicBoolean(false);
    private volatile Subscription subscription;
    private volatile ScheduledFuture<?> timer;

    LongPoll(ServerContext ctx,
             ReadHandler reads,
             HttpServerExchange exchange,
             String path,
             String contentType,
             String waitOffset,
             String etagStart,
             String clientCursor,
             InjectedFault bodyFault) {
        this.ctx = ctx;
        this.reads = reads;
        this.exchange = exchange;
        this.path = path;
        this.contentType = contentType;
        this.waitOffset = waitOffset;
        this.etagStart = etagStart;
        this.clientCursor = clientCursor;
        this.bodyFault = bodyFault;
    }

    void start() {
        exchange.addExchangeCompleteListener((ex, next) -> {
            settled.set(true);
            release();
            next.proceed();
        });
        exchange.dispatch(SameThreadExecutor.INSTANCE, this::await);
    }

    private void await() {
        if (ctx.isShuttingDown()) {
            settle(this::respondIdle);
            return;
        }
        try {
            Subscription sub = ctx.store().subscribe(path, waitOffset, this);
            subscription = sub;
            if (settled.get()) {
                // an event was delivered while subscribing
                sub.cancel();
                return;
            }
            timer = ctx.scheduler().schedule(this::onTimeout, ctx.config().longPollTimeoutMs(), TimeUnit.MILLISECONDS);
            if (settled.get()) {
                release();
            }
        } catch (StoreException e) {
            settle(() -> Exchanges.sendStoreError(exchange, e));
        } catch (RejectedExecutionException e) {
            // timer stopped by shutdown
            settle(this::respondIdle);
        }
    }

    @Override
    public void onEvent(SubscriptionEvent event) {
        switch (event.type()) {
            case APPEND -> settle(() -> reads.sendMessages(
                    exchange, path, contentType, etagStart, event.messages(), waitOffset,
                    true, clientCursor, bodyFault));
            case CLOSED -> settle(() -> respondClosed(event.offset()));
            case ERROR -> settle(this::respondIdle);
        }
    }

    private void onTimeout() {
        settle(this::respondIdle);
    }

    private void settle(Runnable respond) {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        release();
        exchange.getIoThread().execute(() -> {
            try {
                respond.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "long-poll response for " + path + " failed", e);
                exchange.putAttachment(Exchanges.FAILURE, e);
                if (!exchange.isResponseStarted()) {
                    Exchanges.sendText(exchange, 500, "Internal server error");
                }
            }
        });
    }

    private void release() {
        Subscription s = subscription;
        if (s != null) {
            s.cancel();
        }
        ScheduledFuture<?> t = timer;
        if (t != null) {
            t.cancel(false);
        }
    }

    private void respondIdle() {
        StreamMetadata meta = ctx.store().get(path);
        HeaderMap h = exchange.getResponseHeaders();
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, waitOffset);
        h.put(ProtocolHeaders.STREAM_UP_TO_DATE, "true");
        h.put(ProtocolHeaders.STREAM_CURSOR, ctx.cursor().next(clientCursor));
        if (meta != null && meta.closed()) {
            h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        }
        Exchanges.sendEmpty(exchange, 204);
    }

    private void respondClosed(String finalOffset) {
        HeaderMap h = exchange.getResponseHeaders();
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, finalOffset);
        h.put(ProtocolHeaders.STREAM_UP_TO_DATE, "true");
        h.put(ProtocolHeaders.STREAM_CURSOR, ctx.cursor().next(clientCursor));
        h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        Exchanges.sendEmpty(exchange, 204);
    }
}
