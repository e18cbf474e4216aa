package io.groupstream.support;

import com.fasterxml.jackson.databind.JsonNode;
import io.groupstream.transport.codec.EventCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Test client for newline-delimited JSON streams; lines are collected on a
 * background thread.
 */
public final class LineStream implements AutoCloseable {
    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private final HttpResponse<Stream<String>> response;
    private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
    private final Thread reader;

    private LineStream(final HttpResponse<Stream<String>> response) {
        this.response = response;
        this.reader = new Thread(() -> {
            try {
                response.body().forEach(lines::add);
            } catch (final RuntimeException ignored) {
                // stream closed
            }
        }, "line-stream");
        this.reader.setDaemon(true);
        this.reader.start();
    }

    public static LineStream open(final String url) throws IOException, InterruptedException {
        final HttpRequest req = HttpRequest.newBuilder(URI.create(url)).GET().build();
        return new LineStream(CLIENT.send(req, HttpResponse.BodyHandlers.ofLines()));
    }

    public int status() {
        return response.statusCode();
    }

    public String header(final String name) {
        return response.headers().firstValue(name).orElse(null);
    }

    /** Next line as JSON, or {@code null} when none arrives within {@code timeout}. */
    public JsonNode next(final Duration timeout) throws InterruptedException, IOException {
        final String line = lines.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return line == null ? null : EventCodec.MAPPER.readTree(line);
    }

    public static HttpResponse<String> get(final String url) throws IOException, InterruptedException {
        return CLIENT.send(HttpRequest.newBuilder(URI.create(url)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Override
    public void close() {
        response.body().close();
        reader.interrupt();
    }
}
