package com.tidefeed.feeds.api;

import java.util.concurrent.CompletableFuture;

/**
 * Network seam of the scheduler. Implementations complete exceptionally on connection failures and
 * timeouts; any HTTP status, including errors, completes normally.
 */
public interface FeedTransport {
    CompletableFuture<TransportResponse> fetch(TransportRequest request);
}
