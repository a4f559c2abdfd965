package com.tidefeed.feeds.schedule;

import com.tidefeed.core.events.AlertRaised;
import com.tidefeed.core.model.CacheEntry;
import com.tidefeed.core.model.ErrorKind;
import com.tidefeed.core.model.FeedError;
import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.core.model.FetchOutcome;
import com.tidefeed.core.model.Freshness;
import com.tidefeed.core.util.HashingUtils;
import com.tidefeed.feeds.api.FetchContext;
import com.tidefeed.feeds.api.TransportRequest;
import com.tidefeed.feeds.api.TransportResponse;
import com.tidefeed.feeds.parse.FeedParser;
import com.tidefeed.feeds.parse.ParseResult;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one feed from PENDING to a terminal state. Runs on a scheduler worker; the only blocking
 * point is the transport call, bounded by the per-request timeout.
 */
final class FeedFetchTask {
    private static final Logger LOGGER = Logger.getLogger(FeedFetchTask.class.getName());

    private final FeedSpec spec;
    private final FetchContext ctx;
    private final FeedParser parser;
    private volatile FeedState state = FeedState.PENDING;
    private volatile long elapsedMillis = -1;

    FeedFetchTask(FeedSpec spec, FetchContext ctx, FeedParser parser) {
        this.spec = spec;
        this.ctx = ctx;
        this.parser = parser;
    }

    FeedSpec spec() {
        return spec;
    }

    FeedState state() {
        return state;
    }

    /** Wall time of {@link #run()}, or -1 while it has not finished. */
    long elapsedMillis() {
        return elapsedMillis;
    }

    FetchOutcome run() {
        long startedNanos = System.nanoTime();
        try {
            return execute();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Unexpected failure fetching " + spec.url(), e);
            transition(FeedState.FAILED);
            return FetchOutcome.failure(spec, FeedError.of(spec, ErrorKind.NETWORK_ERROR, "Unexpected failure: " + e));
        } finally {
            elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        }
    }

    /**
     * Outcome for a feed that could not finish: serves the cached payload as stale when one exists.
     * Does no network I/O.
     */
    FetchOutcome fallback(FeedError error) {
        transition(FeedState.FAILED);
        return staleOrFailure(readCache(), error);
    }

    private FetchOutcome execute() {
        Optional<CacheEntry> cached = readCache();
        Instant now = ctx.clock().instant();

        if (cached.isPresent() && cached.get().isFresh(now, ctx.settings().cacheTtl())) {
            transition(FeedState.CACHED_OK);
            CacheEntry entry = cached.get();
            ParseResult parsed = parser.parse(entry.rawPayload(), spec, entry.fetchedAt());
            if (!parsed.ok()) {
                transition(FeedState.FAILED);
                return FetchOutcome.failure(spec, FeedError.of(spec, ErrorKind.MALFORMED, parsed.malformedDetail()));
            }
            transition(FeedState.DONE_OK);
            return FetchOutcome.ok(spec, parsed.items(), Freshness.CACHED);
        }

        transition(FeedState.FETCHING);
        Attempt attempt = fetchWithRetries(cached);
        if (attempt.error() != null) {
            transition(FeedState.FAILED);
            return staleOrFailure(cached, attempt.error());
        }

        TransportResponse response = attempt.response();
        Instant fetchedAt = ctx.clock().instant();
        if (response.isNotModified() && cached.isPresent()) {
            transition(FeedState.PARSING);
            CacheEntry previous = cached.get();
            // Undated items keep the time the payload was first downloaded.
            ParseResult parsed = parser.parse(previous.rawPayload(), spec, previous.fetchedAt());
            if (!parsed.ok()) {
                transition(FeedState.FAILED);
                return FetchOutcome.failure(spec, FeedError.of(spec, ErrorKind.MALFORMED, parsed.malformedDetail()));
            }
            FetchOutcome.Ok ok = FetchOutcome.ok(spec, parsed.items(), Freshness.NOT_MODIFIED);
            transition(FeedState.DONE_OK);
            return writeCache(previous.withFetchedAt(fetchedAt), ok);
        }
        if (response.isNotModified()) {
            transition(FeedState.FAILED);
            return FetchOutcome.failure(spec, FeedError.of(spec, ErrorKind.HTTP_ERROR,
                    "HTTP status 304 without a cached copy from " + spec.url()));
        }

        transition(FeedState.PARSING);
        byte[] body = response.body();
        ParseResult parsed = parser.parse(body, spec, fetchedAt);
        if (!parsed.ok()) {
            transition(FeedState.FAILED);
            FeedError error = FeedError.of(spec, ErrorKind.MALFORMED, "Invalid feed from " + spec.url() + ": " + parsed.malformedDetail());
            return staleOrFailure(cached, error);
        }

        CacheEntry entry = new CacheEntry(
                spec.url(),
                fetchedAt,
                response.etag(),
                response.lastModified(),
                body,
                HashingUtils.sha256(body)
        );
        FetchOutcome.Ok ok = FetchOutcome.ok(spec, parsed.items(), Freshness.FETCHED);
        transition(FeedState.DONE_OK);
        return writeCache(entry, ok);
    }

    private Attempt fetchWithRetries(Optional<CacheEntry> cached) {
        TransportRequest request = new TransportRequest(
                spec.url(),
                cached.map(CacheEntry::validator).orElse(null),
                cached.map(CacheEntry::lastModified).orElse(null),
                ctx.settings().requestTimeout()
        );
        if (cached.isPresent() && cached.get().hasValidator()) {
            LOGGER.fine(() -> "Conditional GET for " + spec.url());
        }
        int maxAttempts = ctx.settings().retryAttempts() + 1;
        Attempt last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            last = fetchOnce(request);
            if (!last.retryable() || attempt == maxAttempts) {
                return last;
            }
            long backoffMillis = ctx.settings().retryBackoff().toMillis() << (attempt - 1);
            LOGGER.fine(() -> "Retrying " + spec.url() + " in " + backoffMillis + "ms");
            try {
                Thread.sleep(backoffMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Attempt.failed(FeedError.of(spec, ErrorKind.TIMEOUT, "Cancelled while retrying " + spec.url()), false);
            }
        }
        return last;
    }

    private Attempt fetchOnce(TransportRequest request) {
        CompletableFuture<TransportResponse> future = ctx.transport().fetch(request);
        long timeoutMillis = request.timeout().toMillis();
        TransportResponse response;
        try {
            response = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Attempt.failed(FeedError.of(spec, ErrorKind.TIMEOUT, "Request timed out after " + timeoutMillis + "ms fetching " + spec.url()), false);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Attempt.failed(FeedError.of(spec, ErrorKind.TIMEOUT, "Cancelled while fetching " + spec.url()), false);
        } catch (ExecutionException e) {
            ErrorKind kind = FailureClassifier.classify(e);
            FeedError error = FeedError.of(spec, kind, FailureClassifier.message(spec.url(), e));
            return Attempt.failed(error, FailureClassifier.retryable(kind, 0));
        }

        if (response.isSuccess() || response.isNotModified()) {
            return Attempt.succeeded(response);
        }
        FeedError error = FeedError.of(spec, ErrorKind.HTTP_ERROR, "HTTP status " + response.statusCode() + " from " + spec.url());
        return Attempt.failed(error, FailureClassifier.retryable(ErrorKind.HTTP_ERROR, response.statusCode()));
    }

    private FetchOutcome staleOrFailure(Optional<CacheEntry> cached, FeedError error) {
        if (cached.isEmpty()) {
            return FetchOutcome.failure(spec, error);
        }
        CacheEntry entry = cached.get();
        ParseResult parsed = parser.parse(entry.rawPayload(), spec, entry.fetchedAt());
        if (!parsed.ok()) {
            LOGGER.warning(() -> "Cached payload for " + spec.url() + " is unusable: " + parsed.malformedDetail());
            return FetchOutcome.failure(spec, error);
        }
        LOGGER.info(() -> "Serving " + parsed.items().size() + " stale items for " + spec.name() + " after " + error.kind());
        return FetchOutcome.stale(spec, parsed.items(), error);
    }

    private Optional<CacheEntry> readCache() {
        try {
            return ctx.cacheStore().get(spec.url());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cache read failed for " + spec.url() + "; treating as miss", e);
            return Optional.empty();
        }
    }

    private FetchOutcome writeCache(CacheEntry entry, FetchOutcome.Ok ok) {
        try {
            ctx.cacheStore().put(entry);
            return ok;
        } catch (RuntimeException e) {
            String message = "Cache write failed for " + spec.url() + ": " + e.getMessage();
            LOGGER.log(Level.WARNING, message, e);
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "cache",
                    message,
                    Map.of("name", spec.name(), "url", spec.url())
            ));
            return ok.withWarning(FeedError.of(spec, ErrorKind.CACHE_IO_ERROR, message));
        }
    }

    private void transition(FeedState next) {
        FeedState previous = state;
        state = next;
        LOGGER.finer(() -> spec.url() + ": " + previous + " -> " + next);
    }

    private record Attempt(TransportResponse response, FeedError error, boolean retryable) {
        static Attempt succeeded(TransportResponse response) {
            return new Attempt(response, null, false);
        }

        static Attempt failed(FeedError error, boolean retryable) {
            return new Attempt(null, error, retryable);
        }
    }
}
