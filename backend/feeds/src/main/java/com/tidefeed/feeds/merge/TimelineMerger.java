package com.tidefeed.feeds.merge;

import com.tidefeed.core.model.FeedItem;
import com.tidefeed.core.model.FetchOutcome;
import com.tidefeed.core.model.Freshness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines per-feed items into one timeline ordered by publication time (newest first), then by
 * configured feed position, then by title. The order depends only on item content, never on the
 * order in which fetches completed.
 *
 * <p>A non-zero {@code maxItemAge} drops items published before {@code now - maxItemAge}. Items served
 * stale after a failed fetch are exempt from the window.
 */
public class TimelineMerger {
    private final Duration maxItemAge;
    private final Clock clock;

    public TimelineMerger(Duration maxItemAge, Clock clock) {
        this.maxItemAge = maxItemAge;
        this.clock = clock;
    }

    /**
     * @param outcomes one outcome per feed, in configured feed order
     */
    public List<FeedItem> merge(List<FetchOutcome> outcomes) {
        Instant cutoff = maxItemAge.isZero() ? null : clock.instant().minus(maxItemAge);
        List<Positioned> collected = new ArrayList<>();
        for (int position = 0; position < outcomes.size(); position++) {
            FetchOutcome outcome = outcomes.get(position);
            if (!(outcome instanceof FetchOutcome.Ok ok)) {
                continue;
            }
            boolean windowed = cutoff != null && ok.freshness() != Freshness.STALE;
            Set<ItemKey> seen = new HashSet<>();
            for (FeedItem item : ok.items()) {
                if (windowed && item.publishedAt().isBefore(cutoff)) {
                    continue;
                }
                if (seen.add(new ItemKey(item.link(), item.publishedAt()))) {
                    collected.add(new Positioned(position, item));
                }
            }
        }
        collected.sort(Comparator.comparing((Positioned p) -> p.item().publishedAt(), Comparator.reverseOrder())
                .thenComparingInt(Positioned::position)
                .thenComparing(p -> p.item().title()));
        return collected.stream().map(Positioned::item).toList();
    }

    private record ItemKey(String link, Instant publishedAt) {
    }

    private record Positioned(int position, FeedItem item) {
    }
}
