package com.tidefeed.feeds.schedule;

/**
 * Run-level failure raised before any fetch when there is nothing to fetch.
 */
public class NoFeedsConfiguredException extends RuntimeException {
    public NoFeedsConfiguredException() {
        super("No feeds configured");
    }
}
