package com.opencrawl.crawl.proxy;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed proxy entry: {@code host:port} or {@code scheme://[user:pass@]host:port}.
 */
public record ProxyAddress(String scheme, String host, int port, String username, String password) {
    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    public ProxyAddress {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("proxy host is required");
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("proxy port out of range: " + port);
        }
        scheme = scheme == null ? "http" : scheme.toLowerCase(Locale.ROOT);
        host = host.toLowerCase(Locale.ROOT);
    }

    public static ProxyAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty proxy entry");
        }
        String value = raw.trim();
        if (!value.contains("://")) {
            value = "http://" + value;
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("malformed proxy entry: " + raw, e);
        }
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_SCHEMES.contains(scheme)) {
            throw new IllegalArgumentException("unsupported proxy scheme: " + scheme);
        }
        if (uri.getHost() == null || uri.getPort() < 0) {
            throw new IllegalArgumentException("proxy entry needs host and port: " + raw);
        }
        String username = null;
        String password = null;
        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            username = colon < 0 ? userInfo : userInfo.substring(0, colon);
            password = colon < 0 ? "" : userInfo.substring(colon + 1);
        }
        return new ProxyAddress(scheme, uri.getHost(), uri.getPort(), username, password);
    }

    public String key() {
        return host + ":" + port;
    }

    /** Address without credentials, safe to log. */
    public String url() {
        return scheme + "://" + key();
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public ProxySelector selector() {
        return ProxySelector.of(new InetSocketAddress(host, port));
    }

    /**
     * Answers proxy authentication challenges only, never origin-server ones.
     */
    public Authenticator authenticator() {
        if (!hasCredentials()) {
            return null;
        }
        char[] secret = password == null ? new char[0] : password.toCharArray();
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                if (getRequestorType() != RequestorType.PROXY) {
                    return null;
                }
                return new PasswordAuthentication(username, secret.clone());
            }
        };
    }

    @Override
    public String toString() {
        return url();
    }
}
