package com.tidefeed.app.http;

import com.tidefeed.feeds.api.FeedTransport;
import com.tidefeed.feeds.api.TransportRequest;
import com.tidefeed.feeds.api.TransportResponse;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link FeedTransport} over {@code java.net.http}. Sends conditional GETs when the request carries
 * cached validators.
 */
public class HttpFeedTransport implements FeedTransport {
    private static final String ACCEPT =
            "application/rss+xml, application/atom+xml, application/rdf+xml;q=0.9, application/xml;q=0.8, text/xml;q=0.8, */*;q=0.5";

    private final HttpClient httpClient;
    private final String userAgent;

    public HttpFeedTransport(HttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    @Override
    public CompletableFuture<TransportResponse> fetch(TransportRequest request) {
        HttpRequest httpRequest;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(request.url()))
                    .GET()
                    .timeout(request.timeout())
                    .header("User-Agent", userAgent)
                    .header("Accept", ACCEPT);
            request.ifNoneMatch().ifPresent(etag -> builder.header("If-None-Match", etag));
            request.ifModifiedSince().ifPresent(since -> builder.header("If-Modified-Since", since));
            httpRequest = builder.build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .orTimeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(response -> new TransportResponse(
                        response.statusCode(),
                        response.body(),
                        response.headers().firstValue("ETag").orElse(null),
                        response.headers().firstValue("Last-Modified").orElse(null)
                ));
    }
}
