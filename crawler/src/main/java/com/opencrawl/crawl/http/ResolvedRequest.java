package com.opencrawl.crawl.http;

import com.opencrawl.config.CrawlerConfig;
import com.opencrawl.crawl.model.CrawlRequest;
import com.opencrawl.crawl.proxy.ProxyAddress;
import com.opencrawl.crawl.util.UrlUtils;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * A request with crawler defaults merged in and its egress route fixed.
 */
public record ResolvedRequest(
    URI uri,
    String method,
    Map<String, String> headers,
    String body,
    Duration timeout,
    ProxyAddress proxy,
    boolean followRedirects,
    int maxRedirects
) {
    public ResolvedRequest {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * @throws IllegalArgumentException when the request URL is not an absolute http(s) URL
     */
    public static ResolvedRequest resolve(CrawlRequest request, CrawlerConfig config, ProxyAddress proxy) {
        String target = UrlUtils.appendQueryParams(request.url().trim(), request.params());
        URI uri = UrlUtils.toHttpUri(target);
        if (uri == null) {
            throw new IllegalArgumentException("Not an absolute http(s) URL: " + request.url());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        config.defaultHeaders().forEach((name, value) -> putHeader(headers, name, value));
        if (findHeader(headers, "User-Agent") == null) {
            headers.put("User-Agent", config.userAgent());
        }
        request.headers().forEach((name, value) -> putHeader(headers, name, value));

        Map<String, String> cookies = new LinkedHashMap<>(config.defaultCookies());
        cookies.putAll(request.cookies());
        if (!cookies.isEmpty()) {
            StringJoiner joined = new StringJoiner("; ");
            String explicit = findHeader(headers, "Cookie");
            if (explicit != null && !explicit.isBlank()) {
                joined.add(explicit);
            }
            cookies.forEach((name, value) -> joined.add(name + "=" + (value == null ? "" : value)));
            putHeader(headers, "Cookie", joined.toString());
        }

        Duration timeout = request.timeout() != null && !request.timeout().isNegative() && !request.timeout().isZero()
            ? request.timeout()
            : config.requestTimeout();
        boolean followRedirects = request.followRedirects() != null
            ? request.followRedirects()
            : config.followRedirects();

        return new ResolvedRequest(
            uri,
            request.method(),
            headers,
            request.body(),
            timeout,
            proxy,
            followRedirects,
            config.maxRedirects()
        );
    }

    public boolean viaProxy() {
        return proxy != null;
    }

    public ResolvedRequest withProxy(ProxyAddress replacement) {
        return new ResolvedRequest(uri, method, headers, body, timeout, replacement, followRedirects, maxRedirects);
    }

    private static void putHeader(Map<String, String> headers, String name, String value) {
        if (name == null || name.isBlank() || value == null) {
            return;
        }
        headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
        headers.put(name, value);
    }

    private static String findHeader(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
