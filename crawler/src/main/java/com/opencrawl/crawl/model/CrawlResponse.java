package com.opencrawl.crawl.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one {@link CrawlRequest}. Exactly one of {@code extracted} and {@code error}
 * is set.
 */
public record CrawlResponse(
    CrawlRequest request,
    String finalUrl,
    Integer statusCode,
    Map<String, String> headers,
    String body,
    Duration elapsed,
    int attempts,
    String proxy,
    ExtractionResult extracted,
    CrawlFailure error
) {
    public CrawlResponse {
        Objects.requireNonNull(request, "request");
        if ((extracted == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of extracted or error must be set");
        }
        headers = headers == null ? Map.of() : headers;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static CrawlResponse success(
        CrawlRequest request,
        HttpFetchResult fetch,
        Duration elapsed,
        int attempts,
        String proxy,
        ExtractionResult extracted
    ) {
        return new CrawlResponse(
            request,
            fetch.finalUrlOrRequested(),
            fetch.statusCode(),
            fetch.headers(),
            fetch.body(),
            elapsed,
            attempts,
            proxy,
            extracted,
            null
        );
    }

    public static CrawlResponse failure(
        CrawlRequest request,
        HttpFetchResult lastFetch,
        Duration elapsed,
        String proxy,
        CrawlFailure error
    ) {
        boolean connected = lastFetch != null && lastFetch.hasResponse();
        return new CrawlResponse(
            request,
            lastFetch == null ? request.url() : lastFetch.finalUrlOrRequested(),
            connected ? lastFetch.statusCode() : null,
            connected ? lastFetch.headers() : Map.of(),
            connected ? lastFetch.body() : null,
            elapsed,
            error.attempts(),
            proxy,
            null,
            error
        );
    }

    public String url() {
        return request.url();
    }

    public boolean isSuccess() {
        return error == null;
    }

    public int retries() {
        return Math.max(0, attempts - 1);
    }
}
