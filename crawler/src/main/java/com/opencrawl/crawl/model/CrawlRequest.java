package com.opencrawl.crawl.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One page to fetch. Null overrides fall back to the crawler configuration.
 */
public record CrawlRequest(
    String url,
    String method,
    Map<String, String> headers,
    Map<String, String> cookies,
    Map<String, String> params,
    String body,
    Duration timeout,
    String proxy,
    Boolean followRedirects,
    ExtractionStrategy extractionStrategy,
    Map<String, Object> metadata
) {
    public CrawlRequest {
        Objects.requireNonNull(url, "url");
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = frozen(headers);
        cookies = frozen(cookies);
        params = frozen(params);
        metadata = frozen(metadata);
    }

    public static CrawlRequest of(String url) {
        return builder(url).build();
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    private static <V> Map<String, V> frozen(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {
        private final String url;
        private String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private final Map<String, String> params = new LinkedHashMap<>();
        private String body;
        private Duration timeout;
        private String proxy;
        private Boolean followRedirects;
        private ExtractionStrategy extractionStrategy;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String url) {
            this.url = url;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder cookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public Builder param(String name, String value) {
            params.put(name, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder proxy(String proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder followRedirects(Boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder extractionStrategy(ExtractionStrategy extractionStrategy) {
            this.extractionStrategy = extractionStrategy;
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public CrawlRequest build() {
            return new CrawlRequest(
                url,
                method,
                headers,
                cookies,
                params,
                body,
                timeout,
                proxy,
                followRedirects,
                extractionStrategy,
                metadata
            );
        }
    }
}
