package com.tidefeed.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one aggregation run: the merged timeline plus every per-feed outcome and error.
 * A run is never all-or-nothing; {@code timeline} may be partial.
 */
public record RunReport(
        List<FeedItem> timeline,
        List<FetchOutcome> outcomes,
        List<FeedError> errors,
        Instant startedAt,
        Instant finishedAt
) {
    public RunReport {
        timeline = List.copyOf(timeline);
        outcomes = List.copyOf(outcomes);
        errors = List.copyOf(errors);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean allFailed() {
        return !outcomes.isEmpty() && outcomes.stream().allMatch(FetchOutcome.Err.class::isInstance);
    }
}
