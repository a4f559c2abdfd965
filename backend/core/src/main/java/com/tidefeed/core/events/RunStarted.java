package com.tidefeed.core.events;

import java.time.Instant;

public record RunStarted(Instant timestamp, int feedCount, int maxWorkers) implements Event {
    @Override
    public String type() {
        return "RunStarted";
    }
}
