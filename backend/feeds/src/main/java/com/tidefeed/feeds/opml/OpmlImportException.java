package com.tidefeed.feeds.opml;

public class OpmlImportException extends Exception {
    public OpmlImportException(String message) {
        super(message);
    }

    public OpmlImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
