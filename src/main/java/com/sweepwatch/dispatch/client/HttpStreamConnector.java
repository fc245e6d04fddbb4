package com.sweepwatch.dispatch.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Opens server-sent event streams with {@link HttpClient}. Each connection reads its body
 * on its own daemon thread.
 */
public class HttpStreamConnector implements StreamConnector {

    private static final Logger log = LoggerFactory.getLogger(HttpStreamConnector.class);

    private final HttpClient client;
    private final URI uri;
    private final AtomicInteger readerCounter = new AtomicInteger();

    public HttpStreamConnector(URI uri, Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), uri);
    }

    HttpStreamConnector(HttpClient client, URI uri) {
        this.client = client;
        this.uri = uri;
    }

    @Override
    public StreamConnection connect(StreamListener listener) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "text/event-stream")
                .GET()
                .build();

        AtomicBoolean closed = new AtomicBoolean();
        AtomicReference<Stream<String>> body = new AtomicReference<>();
        log.debug("Connecting to {}", uri);
        CompletableFuture<HttpResponse<Stream<String>>> pending =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofLines());

        pending.whenComplete((response, error) -> {
            if (closed.get()) {
                if (response != null) {
                    response.body().close();
                }
                return;
            }
            if (error != null) {
                listener.onClosed(error);
                return;
            }
            if (response.statusCode() != 200) {
                response.body().close();
                listener.onClosed(new IOException("Server returned HTTP " + response.statusCode()));
                return;
            }
            body.set(response.body());
            Thread reader = new Thread(() -> read(response.body(), listener, closed),
                    "stream-reader-" + readerCounter.incrementAndGet());
            reader.setDaemon(true);
            reader.start();
        });

        return () -> {
            if (closed.compareAndSet(false, true)) {
                pending.cancel(true);
                Stream<String> lines = body.get();
                if (lines != null) {
                    lines.close();
                }
            }
        };
    }

    private static void read(Stream<String> lines, StreamListener listener, AtomicBoolean closed) {
        listener.onOpen();
        SseEventParser parser = new SseEventParser((name, data) -> {
            if (!closed.get()) {
                listener.onEvent(name, data);
            }
        });
        try (lines) {
            lines.forEach(line -> {
                if (closed.get()) {
                    throw new ConnectionClosed();
                }
                parser.accept(line);
            });
            parser.finish();
        } catch (ConnectionClosed e) {
            return;
        } catch (UncheckedIOException e) {
            if (!closed.get()) {
                listener.onClosed(e.getCause());
            }
            return;
        }
        if (!closed.get()) {
            listener.onClosed(null);
        }
    }

    /** Unwinds the line loop once the connection is closed locally. */
    private static final class ConnectionClosed extends RuntimeException {
        ConnectionClosed() {
            super(null, null, false, false);
        }
    }
}
