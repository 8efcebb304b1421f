package io.durastream.server;

import io.durastream.core.ResponseCursor;
import io.durastream.server.fault.FaultInjector;
import io.durastream.storage.StreamStore;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide state shared by every request: the store, config, fault
 * table, open push connections and the timer used for long-poll timeouts
 * and SSE keep-alives.
 * <p>
 * Created once at startup. {@link #shutdown()} is idempotent; after it the
 * context rejects new push connections and is not reusable.
 */
public final class ServerContext {
    private static final Logger log = Logger.getLogger(ServerContext.class.getName());

    private final StreamStore store;
    private final ServerConfig config;
    private final FaultInjector faults;
    private final ResponseCursor cursor;
    private final ScheduledExecutorService scheduler;
    private final Set<PushConnection> connections = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public ServerContext(StreamStore store, ServerConfig config) {
        this(store, config, new FaultInjector());
    }

    public ServerContext(StreamStore store, ServerConfig config, FaultInjector faults) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.faults = Objects.requireNonNull(faults, "faults");
        this.cursor = new ResponseCursor(config.cursorOptions());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads());
    }

    public StreamStore store() {
        return store;
    }

    public ServerConfig config() {
        return config;
    }

    public FaultInjector faults() {
        return faults;
    }

    public ResponseCursor cursor() {
        return cursor;
    }

    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Start tracking a push connection.
     *
     * @return false if the context is shutting down; the caller must close the connection
     */
    public boolean track(PushConnection connection) {
        if (shuttingDown.get()) {
            return false;
        }
        connections.add(connection);
        // shutdown may have drained the set between the check and the add
        if (shuttingDown.get() && connections.remove(connection)) {
            return false;
        }
        return true;
    }

    public void untrack(PushConnection connection) {
        connections.remove(connection);
    }

    public int activeConnections() {
        return connections.size();
    }

    /**
     * Stop accepting live work, release every waiter and close every tracked
     * push connection exactly once. Repeated calls are no-ops.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        store.cancelAllSubscriptions();

        int closed = 0;
        for (PushConnection c : List.copyOf(connections)) {
            if (connections.remove(c)) {
                closeConnection(c);
                closed++;
            }
        }
        scheduler.shutdownNow();
        int n = closed;
        log.info(() -> "server context shut down; closed " + n + " push connection(s)");
    }

    private static void closeConnection(PushConnection c) {
        try {
            c.close();
        } catch (IOException e) {
            // peer already gone; the connection is closed either way
            log.log(Level.FINE, "push connection close failed", e);
        }
    }

    private static java.util.concurrent.ThreadFactory daemonThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "durastream-timer-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
