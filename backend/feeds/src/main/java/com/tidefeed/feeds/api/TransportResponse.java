package com.tidefeed.feeds.api;

public record TransportResponse(int statusCode, byte[] body, String etag, String lastModified) {
    public static final int NOT_MODIFIED = 304;

    public TransportResponse {
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotModified() {
        return statusCode == NOT_MODIFIED;
    }
}
