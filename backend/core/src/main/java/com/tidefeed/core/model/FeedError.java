package com.tidefeed.core.model;

import java.util.Objects;

public record FeedError(
        String url,
        String name,
        ErrorKind kind,
        String message,
        boolean servedStale
) {
    public FeedError {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(kind, "kind is required");
        message = message == null ? kind.name() : message;
    }

    public static FeedError of(FeedSpec spec, ErrorKind kind, String message) {
        return new FeedError(spec.url(), spec.name(), kind, message, false);
    }

    public FeedError markServedStale() {
        return servedStale ? this : new FeedError(url, name, kind, message, true);
    }
}
