package com.opencrawl.crawl.service;

import com.opencrawl.config.CrawlerConfig;
import com.opencrawl.config.CrawlerProperties;
import com.opencrawl.crawl.extract.ExtractionPipeline;
import com.opencrawl.crawl.http.HttpExecutor;
import com.opencrawl.crawl.http.ResolvedRequest;
import com.opencrawl.crawl.model.CrawlRequest;
import com.opencrawl.crawl.model.CrawlResponse;
import com.opencrawl.crawl.model.ExtractionStrategy;
import com.opencrawl.crawl.model.FailureKind;
import com.opencrawl.crawl.model.HttpFetchResult;
import com.opencrawl.crawl.proxy.ProxyAddress;
import com.opencrawl.crawl.proxy.ProxyPool;
import com.opencrawl.crawl.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AsyncCrawlerTest {
    private static final String PAGE = "<html><body><p>Plenty of readable text for the extractor.</p></body></html>";
    private static final ProxyAddress P1 = ProxyAddress.parse("10.0.0.1:8080");
    private static final ProxyAddress P2 = ProxyAddress.parse("10.0.0.2:8080");

    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private AsyncCrawler crawler;

    @AfterEach
    void tearDown() {
        if (crawler != null) {
            crawler.cleanup();
        }
    }

    @Test
    void batchKeepsInputOrderAndIsolatesFailures() {
        crawler = crawler(config(properties -> { }), ProxyPool.passThrough(), request -> {
            if (request.uri().getPath().equals("/b")) {
                return response(request, 404, "text/html", "missing");
            }
            return response(request, 200, "text/html", PAGE);
        });
        crawler.setup();

        List<CrawlResponse> responses = crawler.fetchMany(List.of(
            CrawlRequest.of("https://example.com/a"),
            CrawlRequest.of("https://example.com/b"),
            CrawlRequest.of("https://example.com/c")
        ));

        assertThat(responses).extracting(CrawlResponse::url)
            .containsExactly("https://example.com/a", "https://example.com/b", "https://example.com/c");
        assertThat(responses.get(0).isSuccess()).isTrue();
        assertThat(responses.get(0).extracted().content()).isEqualTo("Plenty of readable text for the extractor.");
        assertThat(responses.get(1).error().kind()).isEqualTo(FailureKind.HTTP_STATUS);
        assertThat(responses.get(1).error().statusCode()).isEqualTo(404);
        assertThat(responses.get(1).error().describe()).startsWith("HTTP_STATUS (404) after 1 attempt");
        assertThat(responses.get(2).isSuccess()).isTrue();
    }

    @Test
    void inFlightRequestsNeverExceedConcurrencyLimit() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        crawler = crawler(
            config(properties -> {
                properties.setMaxConcurrentRequests(2);
                properties.setWorkerThreads(6);
            }),
            ProxyPool.passThrough(),
            request -> {
                int now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(30);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    inFlight.decrementAndGet();
                }
                return response(request, 200, "text/html", PAGE);
            }
        );
        crawler.setup();

        List<CrawlRequest> requests = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            requests.add(CrawlRequest.of("https://example.com/page/" + i));
        }
        List<CrawlResponse> responses = crawler.fetchMany(requests);

        assertThat(responses).hasSize(12).allMatch(CrawlResponse::isSuccess);
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void retriesServerErrorsWithBackoffUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        crawler = crawler(config(properties -> properties.getRetry().setMaxAttempts(4)), ProxyPool.passThrough(), request ->
            calls.incrementAndGet() < 3
                ? response(request, 503, "text/html", "busy")
                : response(request, 200, "text/html", PAGE)
        );
        crawler.setup();

        CrawlResponse response = crawler.fetch(CrawlRequest.of("https://example.com/flaky"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.attempts()).isEqualTo(3);
        assertThat(response.retries()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void persistentServerErrorStopsAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        crawler = crawler(config(properties -> properties.getRetry().setMaxAttempts(4)), ProxyPool.passThrough(), request -> {
            calls.incrementAndGet();
            return response(request, 503, "text/html", "busy");
        });
        crawler.setup();

        CrawlResponse response = crawler.fetch(CrawlRequest.of("https://example.com/down"));

        assertThat(calls).hasValue(4);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(response.error().kind()).isEqualTo(FailureKind.HTTP_STATUS);
        assertThat(response.error().attempts()).isEqualTo(4);
        assertThat(response.statusCode()).isEqualTo(503);
    }

    @Test
    void notFoundIsNeverRetried() {
        AtomicInteger calls = new AtomicInteger();
        crawler = crawler(config(properties -> { }), ProxyPool.passThrough(), request -> {
            calls.incrementAndGet();
            return response(request, 404, "text/html", "missing");
        });
        crawler.setup();

        CrawlResponse response = crawler.fetch(CrawlRequest.of("https://example.com/missing"));

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
        assertThat(response.isSuccess()).isFalse();
    }

    @Test
    void proxyFailureMovesToTheNextHealthyProxy() {
        ProxyPool pool = new ProxyPool(List.of(P1, P2), proxy -> true, 3, Duration.ofMinutes(10));
        List<ProxyAddress> used = Collections.synchronizedList(new ArrayList<>());
        crawler = crawler(config(properties -> { }), pool, request -> {
            used.add(request.proxy());
            if (P1.equals(request.proxy())) {
                return HttpFetchResult.failure(request.uri().toString(), Instant.now(), FailureKind.PROXY_FAILURE, "refused");
            }
            return response(request, 200, "text/html", PAGE);
        });
        crawler.setup();

        CrawlResponse response = crawler.fetch(CrawlRequest.of("https://example.com/"));

        assertThat(used).containsExactly(P1, P2);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.proxy()).isEqualTo(P2.url());
        assertThat(pool.snapshot().get(0).consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void noHealthyProxyEndsRequestWithExhaustion() {
        ProxyPool pool = new ProxyPool(List.of(P1), proxy -> false, 3, Duration.ofMinutes(10));
        AtomicInteger calls = new AtomicInteger();
        crawler = crawler(config(properties -> { }), pool, request -> {
            calls.incrementAndGet();
            return response(request, 200, "text/html", PAGE);
        });
        crawler.setup();

        CrawlResponse response = crawler.fetch(CrawlRequest.of("https://example.com/"));

        assertThat(response.error().kind()).isEqualTo(FailureKind.PROXY_EXHAUSTION);
        assertThat(calls).hasValue(0);
    }

    @Test
    void perRequestProxyBypassesThePool() {
        ProxyPool pool = new ProxyPool(List.of(P1), proxy -> false, 3, Duration.ofMinutes(10));
        AtomicReference<ProxyAddress> used = new AtomicReference<>();
        crawler = crawler(config(properties -> { }), pool, request -> {
            used.set(request.proxy());
            return response(request, 200, "text/html", PAGE);
        });
        crawler.setup();

        CrawlResponse response = crawler.fetch(
            CrawlRequest.builder("https://example.com/").proxy("http://10.0.0.9:3128").build()
        );

        assertThat(response.isSuccess()).isTrue();
        assertThat(used.get().key()).isEqualTo("10.0.0.9:3128");
    }

    @Test
    void malformedUrlFailsWithoutNetworkTraffic() {
        AtomicInteger calls = new AtomicInteger();
        crawler = crawler(config(properties -> { }), ProxyPool.passThrough(), request -> {
            calls.incrementAndGet();
            return response(request, 200, "text/html", PAGE);
        });
        crawler.setup();

        CrawlResponse response = crawler.fetch(CrawlRequest.of("mailto:someone@example.com"));

        assertThat(response.error().kind()).isEqualTo(FailureKind.MALFORMED_URL);
        assertThat(calls).hasValue(0);
    }

    @Test
    void binaryContentIsAnExtractionFailure() {
        crawler = crawler(config(properties -> { }), ProxyPool.passThrough(), request ->
            response(request, 200, "image/png", "\u0089PNG")
        );
        crawler.setup();

        CrawlResponse response = crawler.fetch(CrawlRequest.of("https://example.com/logo.png"));

        assertThat(response.error().kind()).isEqualTo(FailureKind.EXTRACTION_FAILURE);
        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Test
    void requestStrategyOverridesConfiguredOne() {
        crawler = crawler(config(properties -> { }), ProxyPool.passThrough(), request ->
            response(request, 200, "text/html", "<body><h1>A heading long enough</h1></body>")
        );
        crawler.setup();

        CrawlResponse response = crawler.fetch(
            CrawlRequest.builder("https://example.com/").extractionStrategy(ExtractionStrategy.MARKDOWN).build()
        );

        assertThat(response.extracted().strategy()).isEqualTo(ExtractionStrategy.MARKDOWN);
        assertThat(response.extracted().content()).isEqualTo("# A heading long enough");
    }

    @Test
    void fetchBeforeSetupIsRejected() {
        crawler = crawler(config(properties -> { }), ProxyPool.passThrough(), request ->
            response(request, 200, "text/html", PAGE)
        );

        assertThatThrownBy(() -> crawler.fetch(CrawlRequest.of("https://example.com/")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cleanupIsIdempotentAndClosesExecutorOnce() {
        AtomicInteger closes = new AtomicInteger();
        HttpExecutor executor = new HttpExecutor() {
            @Override
            public HttpFetchResult execute(ResolvedRequest request) {
                return response(request, 200, "text/html", PAGE);
            }

            @Override
            public void close() {
                closes.incrementAndGet();
            }
        };
        crawler = crawlerWith(config(properties -> { }), ProxyPool.passThrough(), executor);
        crawler.setup();

        crawler.cleanup();
        crawler.cleanup();
        crawler.close();

        assertThat(closes).hasValue(1);
        assertThat(crawler.isRunning()).isFalse();
    }

    @Test
    void setupFailureIsWrapped() {
        HttpExecutor executor = new HttpExecutor() {
            @Override
            public void open() {
                throw new IllegalStateException("no sockets");
            }

            @Override
            public HttpFetchResult execute(ResolvedRequest request) {
                throw new UnsupportedOperationException();
            }
        };
        crawler = crawlerWith(config(properties -> { }), ProxyPool.passThrough(), executor);

        assertThatThrownBy(crawler::setup)
            .isInstanceOf(CrawlerLifecycleException.class)
            .hasRootCauseMessage("no sockets");
        assertThat(crawler.isRunning()).isFalse();
    }

    @Test
    void interruptingBatchCancelsOutstandingRequests() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch never = new CountDownLatch(1);
        crawler = crawler(config(properties -> properties.setMaxConcurrentRequests(2)), ProxyPool.passThrough(), request -> {
            started.countDown();
            try {
                never.await();
                return response(request, 200, "text/html", PAGE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HttpFetchResult.failure(request.uri().toString(), Instant.now(), FailureKind.CANCELLED, "interrupted");
            }
        });
        crawler.setup();

        AtomicReference<List<CrawlResponse>> result = new AtomicReference<>();
        Thread caller = new Thread(() -> result.set(crawler.fetchMany(List.of(
            CrawlRequest.of("https://example.com/1"),
            CrawlRequest.of("https://example.com/2")
        ))));
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(5_000);

        assertThat(result.get()).hasSize(2);
        assertThat(result.get()).allMatch(response -> response.error().kind() == FailureKind.CANCELLED);
    }

    @Test
    void deeplyNestedPageIsExtractedBySingleAndBatchFetches() {
        String deep = "<html><body>" + "<span>".repeat(20_000) + "Text at the bottom of a very deep page"
            + "</span>".repeat(20_000) + "</body></html>";
        crawler = crawler(config(properties -> { }), ProxyPool.passThrough(),
            request -> response(request, 200, "text/html", deep));
        crawler.setup();
        CrawlRequest request = CrawlRequest.builder("https://example.com/deep")
            .extractionStrategy(ExtractionStrategy.MARKDOWN)
            .build();

        CrawlResponse single = crawler.fetch(request);
        List<CrawlResponse> batch = crawler.fetchMany(List.of(request));

        assertThat(single.isSuccess()).isTrue();
        assertThat(single.extracted().content()).contains("Text at the bottom of a very deep page");
        assertThat(batch.get(0).isSuccess()).isTrue();
    }

    @Test
    void batchTaskErrorIsReportedWithItsOwnKind() {
        CrawlerConfig config = config(properties -> { });
        ExtractionPipeline pipeline = mock(ExtractionPipeline.class);
        when(pipeline.extract(anyString(), anyString(), any())).thenThrow(new StackOverflowError());
        crawler = new AsyncCrawler(
            config,
            ProxyPool.passThrough(),
            request -> response(request, 200, "text/html", PAGE),
            new RetryPolicy(config.retry(), config.sslVerify()),
            pipeline,
            sleeps::add
        );
        crawler.setup();

        List<CrawlResponse> responses = crawler.fetchMany(List.of(
            CrawlRequest.of("https://example.com/a"),
            CrawlRequest.of("https://example.com/b")
        ));

        assertThat(responses).extracting(CrawlResponse::url)
            .containsExactly("https://example.com/a", "https://example.com/b");
        assertThat(responses).allSatisfy(response -> {
            assertThat(response.error().kind()).isEqualTo(FailureKind.EXTRACTION_FAILURE);
            assertThat(response.error().message()).contains("StackOverflowError");
        });
    }

    private AsyncCrawler crawler(CrawlerConfig config, ProxyPool pool, Function<ResolvedRequest, HttpFetchResult> handler) {
        return crawlerWith(config, pool, handler::apply);
    }

    private AsyncCrawler crawlerWith(CrawlerConfig config, ProxyPool pool, HttpExecutor executor) {
        return new AsyncCrawler(
            config,
            pool,
            executor,
            new RetryPolicy(config.retry(), config.sslVerify()),
            new ExtractionPipeline(config.extraction()),
            sleeps::add
        );
    }

    private static CrawlerConfig config(Consumer<CrawlerProperties> customizer) {
        CrawlerProperties properties = new CrawlerProperties();
        customizer.accept(properties);
        return properties.toConfig();
    }

    private static HttpFetchResult response(ResolvedRequest request, int status, String contentType, String body) {
        return new HttpFetchResult(
            request.uri().toString(),
            URI.create(request.uri().toString()),
            status,
            Map.of("Content-Type", contentType),
            body,
            contentType,
            Duration.ofMillis(5),
            null,
            null
        );
    }
}
