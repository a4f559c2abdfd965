package com.tidefeed.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Last successful fetch of one feed URL. {@code validator} carries the ETag and {@code lastModified}
 * the Last-Modified header; either may be null when the server sent none. The payload is copied on
 * the way in and on the way out.
 */
public record CacheEntry(
        String url,
        Instant fetchedAt,
        String validator,
        String lastModified,
        byte[] rawPayload,
        String payloadHash
) {
    public CacheEntry {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        Objects.requireNonNull(rawPayload, "rawPayload is required");
        rawPayload = rawPayload.clone();
    }

    @Override
    public byte[] rawPayload() {
        return rawPayload.clone();
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }

    public boolean hasValidator() {
        return (validator != null && !validator.isBlank()) || (lastModified != null && !lastModified.isBlank());
    }

    public CacheEntry withFetchedAt(Instant refreshedAt) {
        return new CacheEntry(url, refreshedAt, validator, lastModified, rawPayload, payloadHash);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CacheEntry entry)) {
            return false;
        }
        return url.equals(entry.url)
                && fetchedAt.equals(entry.fetchedAt)
                && Objects.equals(validator, entry.validator)
                && Objects.equals(lastModified, entry.lastModified)
                && Arrays.equals(rawPayload, entry.rawPayload)
                && Objects.equals(payloadHash, entry.payloadHash);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(url, fetchedAt, validator, lastModified, payloadHash);
        return 31 * result + Arrays.hashCode(rawPayload);
    }

    @Override
    public String toString() {
        return "CacheEntry[url=" + url
                + ", fetchedAt=" + fetchedAt
                + ", validator=" + validator
                + ", lastModified=" + lastModified
                + ", payloadBytes=" + rawPayload.length
                + ", payloadHash=" + payloadHash + "]";
    }
}
