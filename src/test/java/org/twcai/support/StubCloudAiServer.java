package org.twcai.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * In-process HTTP server that answers registered routes and records every request it receives.
 */
public class StubCloudAiServer implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final Map<String, Function<RecordedRequest, StubResponse>> routes = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    public StubCloudAiServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    public String baseUrl() {
        return "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
    }

    public StubCloudAiServer respond(String method, String path, int status, String body) {
        return respond(method, path, request -> new StubResponse(status, body, "application/json"));
    }

    public StubCloudAiServer respond(String method, String path, Function<RecordedRequest, StubResponse> handler) {
        routes.put(method + " " + path, handler);
        return this;
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    public RecordedRequest lastRequest() {
        if (requests.isEmpty()) {
            throw new IllegalStateException("no request received");
        }
        return requests.get(requests.size() - 1);
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void trickle(OutputStream output, byte[] bytes, Duration delay) throws IOException {
        for (byte b : bytes) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while writing the body", e);
            }
            output.write(b);
            output.flush();
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        RecordedRequest request = new RecordedRequest(
                exchange.getRequestMethod(),
                exchange.getRequestURI().getRawPath(),
                exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders(),
                body);
        requests.add(request);

        Function<RecordedRequest, StubResponse> handler = routes.get(request.getMethod() + " " + request.getPath());
        StubResponse response = handler == null
                ? new StubResponse(404, "no stub for " + request.getMethod() + " " + request.getPath(), "text/plain")
                : handler.apply(request);
        try {
            if (response.getContentType() != null) {
                exchange.getResponseHeaders().add("Content-Type", response.getContentType());
            }
            if (response.getBody() == null || response.getStatus() == 204) {
                exchange.sendResponseHeaders(response.getStatus(), -1);
                return;
            }
            byte[] bytes = response.getBody().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(response.getStatus(), bytes.length);
            try (OutputStream output = exchange.getResponseBody()) {
                if (response.getByteDelay() == null) {
                    output.write(bytes);
                } else {
                    trickle(output, bytes, response.getByteDelay());
                }
            }
        } finally {
            exchange.close();
        }
    }
}
