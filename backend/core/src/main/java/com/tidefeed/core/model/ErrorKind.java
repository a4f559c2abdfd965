package com.tidefeed.core.model;

public enum ErrorKind {
    NETWORK_ERROR,
    TIMEOUT,
    HTTP_ERROR,
    MALFORMED,
    CACHE_IO_ERROR
}
