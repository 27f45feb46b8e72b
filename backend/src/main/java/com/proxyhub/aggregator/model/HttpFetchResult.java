package com.proxyhub.aggregator.model;

import java.net.URI;
import java.time.Duration;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    Duration duration,
    String errorCode,
    String errorMessage,
    Exception failure
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrl() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
