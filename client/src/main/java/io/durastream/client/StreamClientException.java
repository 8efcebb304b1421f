package io.durastream.client;

/**
 * Non-success HTTP answer from the stream server.
 * The full response stays available for header inspection.
 */
public class StreamClientException extends RuntimeException {
    private final transient StreamResponse response;

    public StreamClientException(String operation, StreamResponse response) {
        super(operation + " failed (" + response.status() + "): " + response.text());
        this.response = response;
    }

    public int status() {
        return response.status();
    }

    public StreamResponse response() {
        return response;
    }

    /** 5xx and 429 are worth retrying; other 4xx answers will not change. */
    public boolean isRetryable() {
        int s = response.status();
        return s >= 500 || s == 429;
    }
}
