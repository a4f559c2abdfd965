package com.tidefeed.feeds.api;

import com.tidefeed.core.bus.EventBus;
import com.tidefeed.feeds.config.FetchSettings;

import java.time.Clock;
import java.util.Objects;

public record FetchContext(
        FeedTransport transport,
        CacheStore cacheStore,
        EventBus eventBus,
        Clock clock,
        FetchSettings settings
) {
    public FetchContext {
        Objects.requireNonNull(transport, "transport is required");
        Objects.requireNonNull(cacheStore, "cacheStore is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}
