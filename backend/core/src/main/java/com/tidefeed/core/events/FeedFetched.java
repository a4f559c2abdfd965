package com.tidefeed.core.events;

import com.tidefeed.core.model.ErrorKind;
import com.tidefeed.core.model.Freshness;

import java.time.Instant;

/**
 * Published once per feed when it reaches a terminal state. A failed feed has only {@code failure};
 * a feed that still produced items has {@code freshness}, plus {@code failure} when it was served
 * stale or its cache write failed.
 */
public record FeedFetched(
        Instant timestamp,
        String name,
        String url,
        Freshness freshness,
        ErrorKind failure,
        int itemCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FeedFetched";
    }

    public boolean success() {
        return freshness != null;
    }
}
