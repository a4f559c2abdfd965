package com.tidefeed.feeds.schedule;

enum FeedState {
    PENDING,
    CACHED_OK,
    FETCHING,
    PARSING,
    DONE_OK,
    FAILED
}
