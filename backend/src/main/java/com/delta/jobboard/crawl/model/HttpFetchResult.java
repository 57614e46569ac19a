package com.delta.jobboard.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null || errorMessage.isBlank() ? "" : ": " + errorMessage);
        }
        return "http_" + statusCode;
    }
}
