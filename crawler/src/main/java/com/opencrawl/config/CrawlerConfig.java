package com.opencrawl.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CrawlerConfig(
    int maxConcurrentRequests,
    int workerThreads,
    Duration requestTimeout,
    String userAgent,
    Map<String, String> defaultHeaders,
    Map<String, String> defaultCookies,
    boolean sslVerify,
    boolean followRedirects,
    int maxRedirects,
    RetrySettings retry,
    ProxySettings proxy,
    ExtractionSettings extraction
) {
    public CrawlerConfig {
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be >= 1");
        }
        workerThreads = Math.max(1, workerThreads);
        defaultHeaders = orderedCopy(defaultHeaders);
        defaultCookies = orderedCopy(defaultCookies);
    }

    public static CrawlerConfig defaults() {
        return new CrawlerProperties().toConfig();
    }

    private static Map<String, String> orderedCopy(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
