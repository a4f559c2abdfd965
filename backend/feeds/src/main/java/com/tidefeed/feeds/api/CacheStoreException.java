package com.tidefeed.feeds.api;

public class CacheStoreException extends RuntimeException {
    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
