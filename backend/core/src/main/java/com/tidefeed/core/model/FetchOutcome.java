package com.tidefeed.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of one feed for one run. Failures are carried as values so one feed never
 * affects another.
 */
public sealed interface FetchOutcome permits FetchOutcome.Ok, FetchOutcome.Err {
    FeedSpec spec();

    List<FeedItem> items();

    Optional<FeedError> error();

    static Ok ok(FeedSpec spec, List<FeedItem> items, Freshness freshness) {
        return new Ok(spec, items, freshness, null);
    }

    static Ok stale(FeedSpec spec, List<FeedItem> items, FeedError cause) {
        return new Ok(spec, items.stream().map(FeedItem::asStale).toList(), Freshness.STALE, cause.markServedStale());
    }

    static Err failure(FeedSpec spec, FeedError error) {
        return new Err(spec, error);
    }

    /**
     * Items that reach the timeline. {@code warning} is set when the feed still needs reporting: the
     * refresh failure behind a {@link Freshness#STALE} outcome, or a cache write that failed after a
     * successful fetch.
     */
    record Ok(FeedSpec spec, List<FeedItem> items, Freshness freshness, FeedError warning) implements FetchOutcome {
        public Ok {
            Objects.requireNonNull(spec, "spec is required");
            Objects.requireNonNull(freshness, "freshness is required");
            items = List.copyOf(items);
        }

        public Ok withWarning(FeedError newWarning) {
            return new Ok(spec, items, freshness, newWarning);
        }

        @Override
        public Optional<FeedError> error() {
            return Optional.ofNullable(warning);
        }
    }

    record Err(FeedSpec spec, FeedError cause) implements FetchOutcome {
        public Err {
            Objects.requireNonNull(spec, "spec is required");
            Objects.requireNonNull(cause, "cause is required");
        }

        @Override
        public List<FeedItem> items() {
            return List.of();
        }

        @Override
        public Optional<FeedError> error() {
            return Optional.of(cause());
        }
    }
}
