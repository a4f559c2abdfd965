package com.tidefeed.core.model;

import java.time.Instant;
import java.util.Objects;

public record FeedItem(
        String sourceName,
        String title,
        String link,
        Instant publishedAt,
        String summary,
        boolean stale
) {
    public FeedItem {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
        title = title == null ? "" : title;
        link = link == null ? "" : link;
        summary = summary == null ? "" : summary;
    }

    public FeedItem(String sourceName, String title, String link, Instant publishedAt, String summary) {
        this(sourceName, title, link, publishedAt, summary, false);
    }

    public FeedItem asStale() {
        return stale ? this : new FeedItem(sourceName, title, link, publishedAt, summary, true);
    }

    public String displayLine() {
        return sourceName + " | " + title;
    }
}
