package com.tidefeed.feeds.api;

import com.tidefeed.core.model.CacheEntry;

import java.util.Optional;

/**
 * Persistent raw-response cache keyed by feed URL.
 *
 * <p>{@link #get} never throws: an absent, unreadable or corrupt record is a miss. {@link #put} must be
 * safe to call concurrently for different URLs; callers never write the same URL concurrently.
 */
public interface CacheStore {
    Optional<CacheEntry> get(String url);

    /**
     * Upserts by {@link CacheEntry#url()}.
     *
     * @throws CacheStoreException if the entry could not be persisted
     */
    void put(CacheEntry entry);
}
