package com.tidefeed.feeds.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

public record TransportRequest(String url, String etag, String lastModified, Duration timeout) {
    public TransportRequest {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(timeout, "timeout is required");
    }

    public Optional<String> ifNoneMatch() {
        return Optional.ofNullable(etag).filter(value -> !value.isBlank());
    }

    public Optional<String> ifModifiedSince() {
        return Optional.ofNullable(lastModified).filter(value -> !value.isBlank());
    }
}
