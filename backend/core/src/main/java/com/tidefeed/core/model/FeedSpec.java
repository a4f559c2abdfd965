package com.tidefeed.core.model;

import java.util.Objects;

/**
 * A configured feed. Two specs with the same URL are the same feed regardless of display name.
 */
public record FeedSpec(String name, String url) {
    public FeedSpec {
        Objects.requireNonNull(url, "url is required");
        name = name == null || name.isBlank() ? url : name.trim();
        url = url.trim();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof FeedSpec spec && url.equals(spec.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
