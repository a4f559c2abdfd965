package com.tidefeed.app.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.tidefeed.feeds.api.TransportRequest;
import com.tidefeed.feeds.api.TransportResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpFeedTransportTest {
    private static final String BODY = "<rss version=\"2.0\"><channel/></rss>";

    private HttpServer server;
    private final Map<String, String> seenHeaders = new ConcurrentHashMap<>();
    private HttpFeedTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/feed", exchange -> {
            recordHeaders(exchange);
            String ifNoneMatch = exchange.getRequestHeaders().getFirst("If-None-Match");
            exchange.getResponseHeaders().add("ETag", "\"v2\"");
            exchange.getResponseHeaders().add("Last-Modified", "Sat, 02 Mar 2024 00:00:00 GMT");
            if ("\"v2\"".equals(ifNoneMatch)) {
                exchange.sendResponseHeaders(304, -1);
                exchange.close();
                return;
            }
            writeResponse(exchange, 200, BODY);
        });
        server.createContext("/missing", exchange -> writeResponse(exchange, 404, "not here"));
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, BODY);
        });
        server.start();
        transport = new HttpFeedTransport(HttpClientFactory.create(Duration.ofSeconds(2), Map.of()), "tidefeed-test/1.0");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void plainGetReturnsBodyAndValidators() throws Exception {
        TransportResponse response = transport.fetch(request("/feed", null, null, Duration.ofSeconds(2)))
                .get(5, TimeUnit.SECONDS);

        assertEquals(200, response.statusCode());
        assertEquals(BODY, new String(response.body(), StandardCharsets.UTF_8));
        assertEquals("\"v2\"", response.etag());
        assertEquals("Sat, 02 Mar 2024 00:00:00 GMT", response.lastModified());
        assertEquals("tidefeed-test/1.0", seenHeaders.get("User-Agent"));
        assertTrue(seenHeaders.get("Accept").contains("application/rss+xml"));
        assertFalse(seenHeaders.containsKey("If-None-Match"));
    }

    @Test
    void conditionalGetSendsValidatorsAndSurfacesNotModified() throws Exception {
        TransportResponse response = transport.fetch(request("/feed", "\"v2\"", "Fri, 01 Mar 2024 00:00:00 GMT", Duration.ofSeconds(2)))
                .get(5, TimeUnit.SECONDS);

        assertTrue(response.isNotModified());
        assertEquals(0, response.body().length);
        assertEquals("\"v2\"", seenHeaders.get("If-None-Match"));
        assertEquals("Fri, 01 Mar 2024 00:00:00 GMT", seenHeaders.get("If-Modified-Since"));
    }

    @Test
    void errorStatusIsReturnedNotThrown() throws Exception {
        TransportResponse response = transport.fetch(request("/missing", null, null, Duration.ofSeconds(2)))
                .get(5, TimeUnit.SECONDS);

        assertEquals(404, response.statusCode());
        assertFalse(response.isSuccess());
    }

    @Test
    void slowResponseFailsWithTimeout() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> transport.fetch(request("/slow", null, null, Duration.ofMillis(200))).get(5, TimeUnit.SECONDS));

        Throwable cause = ex.getCause();
        assertTrue(cause instanceof TimeoutException || cause instanceof HttpTimeoutException, String.valueOf(cause));
    }

    @Test
    void invalidUrlFailsTheFuture() {
        TransportRequest bad = new TransportRequest("http://bad host/feed", null, null, Duration.ofSeconds(1));

        assertThrows(ExecutionException.class, () -> transport.fetch(bad).get(5, TimeUnit.SECONDS));
    }

    private TransportRequest request(String path, String etag, String lastModified, Duration timeout) {
        String url = "http://localhost:" + server.getAddress().getPort() + path;
        return new TransportRequest(url, etag, lastModified, timeout);
    }

    private void recordHeaders(HttpExchange exchange) {
        for (String name : new String[]{"User-Agent", "Accept", "If-None-Match", "If-Modified-Since"}) {
            String value = exchange.getRequestHeaders().getFirst(name);
            if (value != null) {
                seenHeaders.put(name, value);
            }
        }
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/rss+xml; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
