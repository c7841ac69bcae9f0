package com.opencrawl.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    Map<String, String> headers,
    String body,
    String contentType,
    Duration duration,
    FailureKind failureKind,
    String errorMessage
) {
    public HttpFetchResult {
        headers = headers == null ? Map.of() : headers;
    }

    public static HttpFetchResult failure(String url, Instant startedAt, FailureKind kind, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            Map.of(),
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            kind,
            message
        );
    }

    /**
     * True when an HTTP response was received, whatever its status.
     */
    public boolean hasResponse() {
        return failureKind == null && statusCode > 0;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
