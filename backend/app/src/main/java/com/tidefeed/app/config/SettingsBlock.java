package com.tidefeed.app.config;

import com.tidefeed.feeds.config.FetchSettings;

import java.time.Duration;

/**
 * The optional {@code settings} object of config.json. Every key may be omitted.
 */
public record SettingsBlock(
        Duration cacheTtl,
        Duration requestTimeout,
        Duration runTimeout,
        Integer maxWorkers,
        Integer retryAttempts,
        Duration retryBackoff,
        Duration maxItemAge,
        String userAgent
) {
    public FetchSettings toFetchSettings() {
        return new FetchSettings(
                cacheTtl == null ? FetchSettings.DEFAULT_CACHE_TTL : cacheTtl,
                requestTimeout == null ? FetchSettings.DEFAULT_REQUEST_TIMEOUT : requestTimeout,
                runTimeout == null ? FetchSettings.DEFAULT_RUN_TIMEOUT : runTimeout,
                maxWorkers == null ? FetchSettings.DEFAULT_MAX_WORKERS : maxWorkers,
                retryAttempts == null ? FetchSettings.DEFAULT_RETRY_ATTEMPTS : retryAttempts,
                retryBackoff == null ? FetchSettings.DEFAULT_RETRY_BACKOFF : retryBackoff,
                maxItemAge == null ? FetchSettings.DEFAULT_MAX_ITEM_AGE : maxItemAge,
                userAgent
        );
    }
}
