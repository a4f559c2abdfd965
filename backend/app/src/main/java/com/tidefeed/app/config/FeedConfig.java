package com.tidefeed.app.config;

import com.tidefeed.core.model.FeedSpec;
import com.tidefeed.feeds.config.FetchSettings;

import java.nio.file.Path;
import java.util.List;

/**
 * Loaded feed list and settings. {@code source} is null when no config file was found.
 */
public record FeedConfig(List<FeedSpec> feeds, FetchSettings settings, Path source) {
    public FeedConfig {
        feeds = List.copyOf(feeds);
    }

    public static FeedConfig empty() {
        return new FeedConfig(List.of(), FetchSettings.defaults(), null);
    }
}
