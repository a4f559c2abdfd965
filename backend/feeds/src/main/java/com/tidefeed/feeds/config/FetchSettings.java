package com.tidefeed.feeds.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of one aggregation run. {@link #maxItemAge()} of zero, the default, disables the age window.
 */
public record FetchSettings(
        Duration cacheTtl,
        Duration requestTimeout,
        Duration runTimeout,
        int maxWorkers,
        int retryAttempts,
        Duration retryBackoff,
        Duration maxItemAge,
        String userAgent
) {
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_WORKERS = 8;
    public static final int MAX_WORKERS_LIMIT = 64;
    public static final int DEFAULT_RETRY_ATTEMPTS = 2;
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_ITEM_AGE = Duration.ZERO;
    public static final String DEFAULT_USER_AGENT = "tidefeed/1.0 (+java.net.http)";

    public FetchSettings {
        Objects.requireNonNull(cacheTtl, "cacheTtl is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        Objects.requireNonNull(runTimeout, "runTimeout is required");
        Objects.requireNonNull(retryBackoff, "retryBackoff is required");
        Objects.requireNonNull(maxItemAge, "maxItemAge is required");
        requirePositive(cacheTtl, "cacheTtl");
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(runTimeout, "runTimeout");
        if (retryBackoff.isNegative() || maxItemAge.isNegative()) {
            throw new IllegalArgumentException("retryBackoff and maxItemAge must not be negative");
        }
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must not be negative");
        }
        maxWorkers = Math.max(1, Math.min(MAX_WORKERS_LIMIT, maxWorkers));
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static FetchSettings defaults() {
        return new FetchSettings(
                DEFAULT_CACHE_TTL,
                DEFAULT_REQUEST_TIMEOUT,
                DEFAULT_RUN_TIMEOUT,
                DEFAULT_MAX_WORKERS,
                DEFAULT_RETRY_ATTEMPTS,
                DEFAULT_RETRY_BACKOFF,
                DEFAULT_MAX_ITEM_AGE,
                DEFAULT_USER_AGENT
        );
    }

    public FetchSettings withRequestTimeout(Duration timeout) {
        return new FetchSettings(cacheTtl, timeout, runTimeout, maxWorkers, retryAttempts, retryBackoff, maxItemAge, userAgent);
    }

    public FetchSettings withRunTimeout(Duration timeout) {
        return new FetchSettings(cacheTtl, requestTimeout, timeout, maxWorkers, retryAttempts, retryBackoff, maxItemAge, userAgent);
    }

    public FetchSettings withMaxWorkers(int workers) {
        return new FetchSettings(cacheTtl, requestTimeout, runTimeout, workers, retryAttempts, retryBackoff, maxItemAge, userAgent);
    }

    public FetchSettings withRetries(int attempts, Duration backoff) {
        return new FetchSettings(cacheTtl, requestTimeout, runTimeout, maxWorkers, attempts, backoff, maxItemAge, userAgent);
    }

    public FetchSettings withMaxItemAge(Duration age) {
        return new FetchSettings(cacheTtl, requestTimeout, runTimeout, maxWorkers, retryAttempts, retryBackoff, age, userAgent);
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
