package com.tidefeed.core.model;

/**
 * How the items of a successful outcome were obtained.
 */
public enum Freshness {
    /** Downloaded on this run. */
    FETCHED,
    /** Server answered 304; the cached payload was reused. */
    NOT_MODIFIED,
    /** Cache entry was within its TTL; no network call was made. */
    CACHED,
    /** Refresh failed; last-known items were served from the cache. */
    STALE
}
