package io.durastream.server;

import java.io.IOException;

/**
 * A long-lived server-push response tracked by {@link ServerContext} so
 * shutdown can close it.
 */
public interface PushConnection {

    /** Close the connection. Closing an already closed connection is a no-op. */
    void close() throws IOException;
}
