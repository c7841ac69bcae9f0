package com.opencrawl.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

public final class UrlUtils {
    private UrlUtils() {
    }

    /**
     * @return an absolute http(s) URI with a host, or null when {@code url} is not one
     */
    public static URI toHttpUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (!isHttpLike(uri.getScheme()) || uri.getHost() == null || uri.getHost().isBlank()) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttpLike(String schemeOrUrl) {
        if (schemeOrUrl == null) {
            return false;
        }
        String lower = schemeOrUrl.toLowerCase(Locale.ROOT);
        return lower.equals("http")
            || lower.equals("https")
            || lower.startsWith("http://")
            || lower.startsWith("https://");
    }

    public static String appendQueryParams(String url, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return url;
        }
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
            query.append('=');
            query.append(URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
        }
        int hash = url.indexOf('#');
        String base = hash < 0 ? url : url.substring(0, hash);
        String fragment = hash < 0 ? "" : url.substring(hash);
        char separator = base.indexOf('?') < 0 ? '?' : (base.endsWith("?") || base.endsWith("&") ? '\0' : '&');
        StringBuilder out = new StringBuilder(base);
        if (separator != '\0') {
            out.append(separator);
        }
        return out.append(query).append(fragment).toString();
    }
}
