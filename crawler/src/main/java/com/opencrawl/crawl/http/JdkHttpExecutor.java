package com.opencrawl.crawl.http;

import com.opencrawl.config.CrawlerConfig;
import com.opencrawl.crawl.model.FailureKind;
import com.opencrawl.crawl.model.HttpFetchResult;
import com.opencrawl.crawl.proxy.ProxyAddress;
import com.opencrawl.crawl.util.FailureClassifier;
import com.opencrawl.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.Authenticator;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpExecutor} on {@link HttpClient}. Keeps one client per egress route (direct or
 * through a given proxy) so connections are pooled across requests; redirects are followed
 * here rather than by the client so that the hop limit is enforced exactly.
 */
public class JdkHttpExecutor implements HttpExecutor {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpExecutor.class);
    private static final String DIRECT_ROUTE = "direct";
    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");
    private static final Set<String> CREDENTIAL_HEADERS = Set.of("authorization", "cookie", "proxy-authorization");

    private final CrawlerConfig config;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();
    private volatile ExecutorService httpExecutor;
    private volatile SSLContext sslContext;

    public JdkHttpExecutor(CrawlerConfig config) {
        this.config = config;
    }

    @Override
    public synchronized void open() {
        if (httpExecutor != null) {
            return;
        }
        sslContext = config.sslVerify() ? null : trustAllContext();
        httpExecutor = Executors.newFixedThreadPool(Math.max(4, config.maxConcurrentRequests() * 2));
    }

    @Override
    public HttpFetchResult execute(ResolvedRequest request) {
        Instant startedAt = Instant.now();
        String requestedUrl = request.uri().toString();
        if (httpExecutor == null) {
            throw new IllegalStateException("HTTP executor is not open");
        }
        HttpClient client = clientFor(request.proxy());
        URI current = request.uri();
        String method = request.method();
        String body = request.body();
        Map<String, String> headers = request.headers();
        int redirects = 0;
        try {
            while (true) {
                Duration remaining = request.timeout().minus(Duration.between(startedAt, Instant.now()));
                if (remaining.isNegative() || remaining.isZero()) {
                    return HttpFetchResult.failure(requestedUrl, startedAt, FailureKind.TIMEOUT, "request timed out");
                }
                HttpResponse<byte[]> response = client.send(
                    buildRequest(current, method, body, headers, remaining),
                    HttpResponse.BodyHandlers.ofByteArray()
                );
                int status = response.statusCode();
                Optional<String> location = response.headers().firstValue("Location");
                if (!request.followRedirects() || !REDIRECT_STATUSES.contains(status) || location.isEmpty()) {
                    return toResult(requestedUrl, startedAt, response);
                }
                if (redirects >= request.maxRedirects()) {
                    return HttpFetchResult.failure(
                        requestedUrl,
                        startedAt,
                        FailureKind.REDIRECT_LIMIT_EXCEEDED,
                        "Exceeded " + request.maxRedirects() + " redirects"
                    );
                }
                redirects++;
                URI next = current.resolve(location.get().trim());
                if (UrlUtils.toHttpUri(next.toString()) == null) {
                    return HttpFetchResult.failure(
                        requestedUrl,
                        startedAt,
                        FailureKind.MALFORMED_URL,
                        "Redirect to unsupported location " + next
                    );
                }
                log.debug("Redirect {} -> {} ({})", current, next, status);
                if (status == 303 || ((status == 301 || status == 302) && !"HEAD".equals(method))) {
                    method = "GET";
                    body = null;
                }
                if (!sameOrigin(current, next)) {
                    headers = withoutCredentials(headers);
                }
                current = next;
            }
        } catch (IOException e) {
            FailureKind kind = FailureClassifier.fromException(e, request.viaProxy());
            return HttpFetchResult.failure(requestedUrl, startedAt, kind, describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(requestedUrl, startedAt, FailureKind.CANCELLED, "interrupted");
        } catch (IllegalArgumentException e) {
            return HttpFetchResult.failure(requestedUrl, startedAt, FailureKind.MALFORMED_URL, e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        ExecutorService executor = httpExecutor;
        httpExecutor = null;
        clients.clear();
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static boolean sameOrigin(URI a, URI b) {
        return a.getScheme().equalsIgnoreCase(b.getScheme())
            && a.getHost() != null
            && a.getHost().equalsIgnoreCase(b.getHost())
            && effectivePort(a) == effectivePort(b);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static Map<String, String> withoutCredentials(Map<String, String> headers) {
        Map<String, String> kept = new LinkedHashMap<>();
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (!CREDENTIAL_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                kept.put(header.getKey(), header.getValue());
            }
        }
        return kept;
    }

    private HttpClient clientFor(ProxyAddress proxy) {
        String route = proxy == null ? DIRECT_ROUTE : proxy.url();
        return clients.computeIfAbsent(route, ignored -> buildClient(proxy));
    }

    private HttpClient buildClient(ProxyAddress proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(config.requestTimeout())
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        if (proxy != null) {
            builder.proxy(proxy.selector());
            Authenticator authenticator = proxy.authenticator();
            if (authenticator != null) {
                builder.authenticator(authenticator);
            }
        }
        return builder.build();
    }

    private HttpRequest buildRequest(URI uri, String method, String body, Map<String, String> headers, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout);
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                log.debug("Dropping restricted header {}", header.getKey());
                continue;
            }
            builder.header(header.getKey(), header.getValue());
        }
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        return builder.method(method, publisher).build();
    }

    private HttpFetchResult toResult(String requestedUrl, Instant startedAt, HttpResponse<byte[]> response) {
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        byte[] bytes = response.body();
        String text = bytes == null ? null : new String(bytes, charsetOf(contentType));
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            if (!entry.getValue().isEmpty() && !entry.getKey().startsWith(":")) {
                headers.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return new HttpFetchResult(
            requestedUrl,
            response.uri(),
            response.statusCode(),
            headers,
            text,
            contentType,
            Duration.between(startedAt, Instant.now()),
            null,
            null
        );
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    log.debug("Unknown charset {}, falling back to UTF-8", name);
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static SSLContext trustAllContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to build SSL context with verification disabled", e);
        }
    }

    /**
     * Accepts every certificate chain and skips hostname checks. Only installed when
     * certificate verification is switched off.
     */
    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
