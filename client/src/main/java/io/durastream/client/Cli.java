package io.durastream.client;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Simple CLI for interacting with a running stream server over HTTP.
 *
 * Usage:
 *   durastream-cli [--base-url http://host:port] create <path> [content-type]
 *   durastream-cli [--base-url http://host:port] append <path> <text> [content-type]
 *   durastream-cli [--base-url http://host:port] read   <path> [offset]
 *   durastream-cli [--base-url http://host:port] tail   <path> [offset]
 *   durastream-cli [--base-url http://host:port] head   <path>
 *   durastream-cli [--base-url http://host:port] close  <path>
 *   durastream-cli [--base-url http://host:port] delete <path>
 *
 * Examples:
 *   durastream-cli create /chat/1 application/json
 *   durastream-cli append /chat/1 '{"text":"hi"}' application/json
 *   durastream-cli tail /chat/1
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:4437";
    private static final String DEFAULT_CONTENT_TYPE = "text/plain";

    private final StreamClient client;

    private Cli(String baseUrl) {
        this.client = new StreamClient(baseUrl);
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length < 2) {
                usageAndExit(rest.length == 0 ? "missing command" : rest[0] + " requires <path>");
            }

            String cmd = rest[0];
            String path = rest[1];
            Cli cli = new Cli(parsed.getKey());

            switch (cmd) {
                case "create" -> cli.create(path, arg(rest, 2, DEFAULT_CONTENT_TYPE));
                case "append" -> {
                    if (rest.length < 3) {
                        usageAndExit("append requires <path> <text>");
                    }
                    cli.append(path, rest[2], arg(rest, 3, DEFAULT_CONTENT_TYPE));
                }
                case "read" -> cli.read(path, arg(rest, 2, "-1"));
                case "tail" -> cli.tail(path, arg(rest, 2, "now"));
                case "head" -> cli.head(path);
                case "close" -> cli.close(path);
                case "delete" -> cli.delete(path);
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (StreamClientException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static String arg(String[] args, int i, String fallback) {
        return args.length > i ? args[i] : fallback;
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private void create(String path, String contentType) throws Exception {
        StreamResponse r = client.create(path, contentType);
        System.out.println((r.status() == 201 ? "created " : "exists ") + path + " @ " + r.nextOffset());
    }

    private void append(String path, String text, String contentType) throws Exception {
        AppendAck ack = client.append(path, contentType, text.getBytes(StandardCharsets.UTF_8));
        System.out.println("OK " + ack.offset());
    }

    private void read(String path, String offset) throws Exception {
        StreamResponse r = client.read(path, offset);
        System.out.println(r.text());
        System.err.println("next offset: " + r.nextOffset() + (r.closed() ? " (closed)" : ""));
    }

    /** Long-poll loop; ends when the stream is closed. */
    private void tail(String path, String offset) throws Exception {
        String next = offset;
        String cursor = null;
        while (true) {
            StreamResponse r = client.longPoll(path, next, cursor);
            if (r.bodyLength() > 0) {
                System.out.println(r.text());
            }
            if (r.nextOffset() != null) {
                next = r.nextOffset();
            }
            if (r.cursor() != null) {
                cursor = r.cursor();
            }
            if (r.closed()) {
                System.err.println("stream closed at " + next);
                return;
            }
        }
    }

    private void head(String path) throws Exception {
        var meta = client.head(path);
        if (meta.isEmpty()) {
            System.out.println("(not found)");
            return;
        }
        StreamResponse r = meta.get();
        System.out.println("content-type: " + r.header("Content-Type").orElse("?"));
        System.out.println("next offset:  " + r.nextOffset());
        System.out.println("closed:       " + r.closed());
    }

    private void close(String path) throws Exception {
        System.out.println("closed at " + client.close(path).offset());
    }

    private void delete(String path) throws Exception {
        System.out.println(client.delete(path) ? "OK" : "(not found)");
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  durastream-cli [--base-url http://host:port] create <path> [content-type]
                  durastream-cli [--base-url http://host:port] append <path> <text> [content-type]
                  durastream-cli [--base-url http://host:port] read   <path> [offset]
                  durastream-cli [--base-url http://host:port] tail   <path> [offset]
                  durastream-cli [--base-url http://host:port] head   <path>
                  durastream-cli [--base-url http://host:port] close  <path>
                  durastream-cli [--base-url http://host:port] delete <path>
                """);
        System.exit(1);
    }
}
