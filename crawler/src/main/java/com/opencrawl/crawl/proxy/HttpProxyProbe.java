package com.opencrawl.crawl.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Authenticator;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates a proxy by sending one GET to a test endpoint through it. One client is kept per
 * proxy so that repeated validation reuses its connection pool.
 */
public class HttpProxyProbe implements ProxyProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpProxyProbe.class);

    private final URI testUri;
    private final Duration timeout;
    private final String userAgent;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    public HttpProxyProbe(String testUrl, Duration timeout, String userAgent) {
        this.testUri = URI.create(testUrl);
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public boolean probe(ProxyAddress proxy) {
        HttpRequest request = HttpRequest.newBuilder(testUri)
            .timeout(timeout)
            .header("User-Agent", userAgent)
            .GET()
            .build();
        try {
            HttpResponse<Void> response = clientFor(proxy).send(request, HttpResponse.BodyHandlers.discarding());
            boolean passed = response.statusCode() >= 200 && response.statusCode() < 300;
            if (passed) {
                log.info("Proxy OK: {}", proxy.url());
            } else {
                log.warn("Proxy check failed for {}: HTTP {}", proxy.url(), response.statusCode());
            }
            return passed;
        } catch (IOException e) {
            log.warn("Proxy check failed for {}: {}", proxy.url(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    HttpClient clientFor(ProxyAddress proxy) {
        return clients.computeIfAbsent(proxy.url(), ignored -> buildClient(proxy));
    }

    private HttpClient buildClient(ProxyAddress proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .proxy(proxy.selector())
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .version(HttpClient.Version.HTTP_1_1);
        Authenticator authenticator = proxy.authenticator();
        if (authenticator != null) {
            builder.authenticator(authenticator);
        }
        return builder.build();
    }
}
