package com.tidefeed.feeds.schedule;

import com.tidefeed.core.model.FetchOutcome;

import java.util.List;

/**
 * Outcomes of one scheduler run, one per distinct feed URL, in configured order.
 */
public record FetchBatch(List<FetchOutcome> outcomes, boolean softTimeoutHit) {
    public FetchBatch {
        outcomes = List.copyOf(outcomes);
    }
}
