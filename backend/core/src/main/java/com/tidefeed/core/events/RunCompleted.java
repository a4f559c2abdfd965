package com.tidefeed.core.events;

import java.time.Instant;

public record RunCompleted(
        Instant timestamp,
        int feedCount,
        int failures,
        int itemCount,
        boolean softTimeoutHit,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RunCompleted";
    }
}
