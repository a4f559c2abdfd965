package com.tidefeed.feeds.cache;

import com.tidefeed.core.model.CacheEntry;
import com.tidefeed.feeds.api.CacheStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache. Nothing survives a restart.
 */
public class InMemoryCacheStore implements CacheStore {
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> get(String url) {
        return Optional.ofNullable(entries.get(url));
    }

    @Override
    public void put(CacheEntry entry) {
        entries.put(entry.url(), entry);
    }

    public int size() {
        return entries.size();
    }
}
