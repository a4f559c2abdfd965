package com.tidefeed.feeds.parse;

import com.tidefeed.core.model.FeedItem;

import java.util.List;

/**
 * Either the parsed items or a description of why the payload could not be read.
 */
public record ParseResult(List<FeedItem> items, String malformedDetail) {
    public ParseResult {
        items = List.copyOf(items);
    }

    public static ParseResult success(List<FeedItem> items) {
        return new ParseResult(items, null);
    }

    public static ParseResult malformed(String detail) {
        return new ParseResult(List.of(), detail == null ? "malformed feed" : detail);
    }

    public boolean ok() {
        return malformedDetail == null;
    }
}
