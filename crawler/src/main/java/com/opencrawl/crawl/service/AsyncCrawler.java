package com.opencrawl.crawl.service;

import com.opencrawl.config.CrawlerConfig;
import com.opencrawl.crawl.extract.ExtractionException;
import com.opencrawl.crawl.extract.ExtractionPipeline;
import com.opencrawl.crawl.http.HttpExecutor;
import com.opencrawl.crawl.http.JdkHttpExecutor;
import com.opencrawl.crawl.http.ResolvedRequest;
import com.opencrawl.crawl.model.CrawlFailure;
import com.opencrawl.crawl.model.CrawlRequest;
import com.opencrawl.crawl.model.CrawlResponse;
import com.opencrawl.crawl.model.ExtractionResult;
import com.opencrawl.crawl.model.FailureKind;
import com.opencrawl.crawl.model.HttpFetchResult;
import com.opencrawl.crawl.proxy.HttpProxyProbe;
import com.opencrawl.crawl.proxy.ProxyAddress;
import com.opencrawl.crawl.proxy.ProxyExhaustedException;
import com.opencrawl.crawl.proxy.ProxyPool;
import com.opencrawl.crawl.proxy.ProxyRecord;
import com.opencrawl.crawl.retry.RetryDecision;
import com.opencrawl.crawl.retry.RetryPolicy;
import com.opencrawl.crawl.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fetches pages concurrently through an optional proxy pool, retrying transient failures
 * and extracting content from every successful response.
 *
 * <p>Usage: {@link #setup()}, any number of {@link #fetch}/{@link #fetchMany} calls, then
 * {@link #cleanup()} (or try-with-resources). Failures of individual requests never throw;
 * they are reported through {@link CrawlResponse#error()}.
 */
public class AsyncCrawler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncCrawler.class);

    private final CrawlerConfig config;
    private final ProxyPool proxyPool;
    private final HttpExecutor httpExecutor;
    private final RetryPolicy retryPolicy;
    private final ExtractionPipeline extractionPipeline;
    private final ConcurrencyGate gate;
    private final Sleeper sleeper;

    private volatile ExecutorService workers;

    public AsyncCrawler(
        CrawlerConfig config,
        ProxyPool proxyPool,
        HttpExecutor httpExecutor,
        RetryPolicy retryPolicy,
        ExtractionPipeline extractionPipeline
    ) {
        this(config, proxyPool, httpExecutor, retryPolicy, extractionPipeline, Sleeper.THREAD);
    }

    AsyncCrawler(
        CrawlerConfig config,
        ProxyPool proxyPool,
        HttpExecutor httpExecutor,
        RetryPolicy retryPolicy,
        ExtractionPipeline extractionPipeline,
        Sleeper sleeper
    ) {
        this.config = config;
        this.proxyPool = proxyPool;
        this.httpExecutor = httpExecutor;
        this.retryPolicy = retryPolicy;
        this.extractionPipeline = extractionPipeline;
        this.gate = new ConcurrencyGate(config.maxConcurrentRequests());
        this.sleeper = sleeper;
    }

    public static AsyncCrawler create(CrawlerConfig config) {
        ProxyPool pool = config.proxy().hasSource()
            ? ProxyPool.fromSettings(
                config.proxy(),
                new HttpProxyProbe(config.proxy().testUrl(), config.proxy().probeTimeout(), config.userAgent())
            )
            : ProxyPool.passThrough();
        return new AsyncCrawler(
            config,
            pool,
            new JdkHttpExecutor(config),
            new RetryPolicy(config.retry(), config.sslVerify()),
            new ExtractionPipeline(config.extraction())
        );
    }

    public synchronized void setup() {
        if (workers != null) {
            return;
        }
        ExecutorService pool = Executors.newFixedThreadPool(config.workerThreads());
        try {
            httpExecutor.open();
            proxyPool.validateAll();
        } catch (RuntimeException e) {
            pool.shutdownNow();
            closeExecutorQuietly();
            throw new CrawlerLifecycleException("Crawler setup failed: " + e.getMessage(), e);
        }
        workers = pool;
        if (proxyPool.isPassThrough()) {
            log.info("Crawler ready: {} concurrent requests, direct connections", gate.capacity());
        } else {
            log.info(
                "Crawler ready: {} concurrent requests, {}/{} healthy proxies",
                gate.capacity(),
                proxyPool.healthyCount(),
                proxyPool.size()
            );
        }
    }

    public boolean isRunning() {
        return workers != null;
    }

    /**
     * Runs every request on the worker pool and returns the responses in input order.
     * Interrupting the calling thread cancels the requests still running; their entries
     * carry a {@link FailureKind#CANCELLED} error.
     */
    public List<CrawlResponse> fetchMany(List<CrawlRequest> requests) {
        ExecutorService pool = requireRunning();
        List<Future<CrawlResponse>> futures = new ArrayList<>(requests.size());
        for (CrawlRequest request : requests) {
            futures.add(pool.submit(() -> fetch(request)));
        }

        List<CrawlResponse> responses = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            CrawlRequest request = requests.get(i);
            try {
                responses.add(futures.get(i).get());
            } catch (InterruptedException e) {
                log.warn("Batch interrupted, cancelling {} outstanding requests", futures.size() - i);
                for (int j = i; j < futures.size(); j++) {
                    responses.add(completedOrCancelled(requests.get(j), futures.get(j)));
                }
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.warn("Request task for {} aborted", request.url(), e.getCause());
                responses.add(aborted(request, e.getCause()));
            }
        }
        return responses;
    }

    /**
     * Fetches and extracts a single page, holding a concurrency slot for the whole exchange
     * including retries.
     *
     * @throws IllegalStateException when called before {@link #setup()} or after {@link #cleanup()}
     */
    public CrawlResponse fetch(CrawlRequest request) {
        requireRunning();
        Instant startedAt = Instant.now();
        try (ConcurrencyGate.Permit permit = gate.acquire()) {
            return execute(request, startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CrawlResponse.failure(
                request,
                null,
                Duration.between(startedAt, Instant.now()),
                null,
                CrawlFailure.of(FailureKind.CANCELLED, "interrupted while waiting for a request slot", 0)
            );
        }
    }

    private CrawlResponse execute(CrawlRequest request, Instant startedAt) {
        ResolvedRequest resolved;
        ProxyAddress fixedProxy = null;
        try {
            if (request.proxy() != null && !request.proxy().isBlank()) {
                fixedProxy = ProxyAddress.parse(request.proxy());
            }
            resolved = ResolvedRequest.resolve(request, config, null);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {}: {}", request.url(), e.getMessage());
            return failed(request, null, startedAt, null, CrawlFailure.of(FailureKind.MALFORMED_URL, e.getMessage(), 0));
        }

        HttpFetchResult last = null;
        String proxyUsed = null;
        int attempts = 0;
        while (true) {
            ProxyRecord pooled = null;
            ProxyAddress proxy = fixedProxy;
            if (proxy == null) {
                try {
                    pooled = proxyPool.acquire().orElse(null);
                } catch (ProxyExhaustedException e) {
                    log.warn("No proxy available for {}: {}", request.url(), e.getMessage());
                    CrawlFailure failure = CrawlFailure.of(FailureKind.PROXY_EXHAUSTION, e.getMessage(), attempts);
                    return failed(request, last, startedAt, proxyUsed, failure);
                }
                proxy = pooled == null ? null : pooled.address();
            }
            proxyUsed = proxy == null ? null : proxy.url();

            HttpFetchResult result = attempt(resolved.withProxy(proxy));
            last = result;
            attempts++;
            CrawlFailure failure = classify(result, proxy != null, attempts);
            report(pooled, result, failure);

            if (failure == null) {
                return complete(request, result, startedAt, attempts, proxyUsed);
            }
            RetryDecision decision = retryPolicy.decide(attempts - 1, failure);
            if (!decision.retry()) {
                log.warn("Giving up on {}: {}", request.url(), failure.describe());
                return failed(request, result, startedAt, proxyUsed, failure);
            }
            log.debug(
                "Attempt {} for {} failed ({}), retrying in {} ms",
                attempts,
                request.url(),
                failure.kind(),
                decision.delay().toMillis()
            );
            try {
                sleeper.sleep(decision.delay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CrawlFailure cancelled = CrawlFailure.of(FailureKind.CANCELLED, "interrupted during backoff", attempts);
                return failed(request, result, startedAt, proxyUsed, cancelled);
            }
        }
    }

    private HttpFetchResult attempt(ResolvedRequest request) {
        Instant startedAt = Instant.now();
        try {
            return httpExecutor.execute(request);
        } catch (RuntimeException e) {
            log.warn("HTTP executor failed for {}", request.uri(), e);
            FailureKind kind = FailureClassifier.fromException(e, request.viaProxy());
            return HttpFetchResult.failure(request.uri().toString(), startedAt, kind, e.getMessage());
        }
    }

    static CrawlFailure classify(HttpFetchResult result, boolean viaProxy, int attempts) {
        if (result.failureKind() != null) {
            return new CrawlFailure(result.failureKind(), null, result.errorMessage(), attempts);
        }
        int status = result.statusCode();
        if (status >= 400) {
            FailureKind kind = FailureClassifier.fromHttpStatus(status, viaProxy);
            return new CrawlFailure(kind, status, "HTTP " + status + " from " + result.finalUrlOrRequested(), attempts);
        }
        return null;
    }

    // Any response proves the proxy relayed traffic, except a 407 from the proxy itself.
    private void report(ProxyRecord pooled, HttpFetchResult result, CrawlFailure failure) {
        if (pooled == null) {
            return;
        }
        if (result.hasResponse()) {
            if (result.statusCode() == 407) {
                proxyPool.reportFailure(pooled);
            } else {
                proxyPool.reportSuccess(pooled);
            }
        } else if (failure != null && failure.kind().isNetworkLevel()) {
            proxyPool.reportFailure(pooled);
        }
    }

    private CrawlResponse complete(
        CrawlRequest request,
        HttpFetchResult result,
        Instant startedAt,
        int attempts,
        String proxyUsed
    ) {
        if (!ExtractionPipeline.supportsContentType(result.contentType())) {
            CrawlFailure failure = CrawlFailure.of(
                FailureKind.EXTRACTION_FAILURE,
                "Unsupported content type " + result.contentType(),
                attempts
            );
            log.warn("Skipping extraction for {}: {}", request.url(), failure.message());
            return failed(request, result, startedAt, proxyUsed, failure);
        }
        ExtractionResult extracted;
        try {
            extracted = extractionPipeline.extract(
                result.body(),
                result.finalUrlOrRequested(),
                request.extractionStrategy()
            );
        } catch (ExtractionException e) {
            log.warn("Extraction failed for {}", request.url(), e);
            CrawlFailure failure = CrawlFailure.of(FailureKind.EXTRACTION_FAILURE, e.getMessage(), attempts);
            return failed(request, result, startedAt, proxyUsed, failure);
        }
        Duration elapsed = Duration.between(startedAt, Instant.now());
        log.debug("Fetched {} ({}) in {} ms after {} attempts", request.url(), result.statusCode(), elapsed.toMillis(), attempts);
        return CrawlResponse.success(request, result, elapsed, attempts, proxyUsed, extracted);
    }

    private static CrawlResponse failed(
        CrawlRequest request,
        HttpFetchResult last,
        Instant startedAt,
        String proxyUsed,
        CrawlFailure failure
    ) {
        return CrawlResponse.failure(request, last, Duration.between(startedAt, Instant.now()), proxyUsed, failure);
    }

    private static CrawlResponse completedOrCancelled(CrawlRequest request, Future<CrawlResponse> future) {
        if (future.cancel(true) || !future.isDone()) {
            return cancelled(request, "batch cancelled");
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            return aborted(request, e.getCause());
        } catch (InterruptedException e) {
            return cancelled(request, "batch cancelled");
        }
    }

    private static CrawlResponse aborted(CrawlRequest request, Throwable cause) {
        FailureKind kind;
        if (cause instanceof ExtractionException || cause instanceof StackOverflowError) {
            kind = FailureKind.EXTRACTION_FAILURE;
        } else if (cause instanceof InterruptedException) {
            kind = FailureKind.CANCELLED;
        } else {
            kind = FailureClassifier.fromException(cause, false);
        }
        CrawlFailure failure = CrawlFailure.of(kind, "request task failed: " + cause, 0);
        return CrawlResponse.failure(request, null, Duration.ZERO, null, failure);
    }

    private static CrawlResponse cancelled(CrawlRequest request, String message) {
        return CrawlResponse.failure(request, null, Duration.ZERO, null, CrawlFailure.of(FailureKind.CANCELLED, message, 0));
    }

    private ExecutorService requireRunning() {
        ExecutorService pool = workers;
        if (pool == null) {
            throw new IllegalStateException("Crawler is not set up; call setup() first");
        }
        return pool;
    }

    /**
     * Releases the worker pool and HTTP connections. Safe to call more than once.
     */
    public synchronized void cleanup() {
        ExecutorService pool = workers;
        if (pool == null) {
            return;
        }
        workers = null;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            httpExecutor.close();
        } catch (RuntimeException e) {
            throw new CrawlerLifecycleException("Failed to release HTTP resources", e);
        }
        log.info("Crawler stopped");
    }

    private void closeExecutorQuietly() {
        try {
            httpExecutor.close();
        } catch (RuntimeException e) {
            log.warn("Failed to release HTTP resources after setup error", e);
        }
    }

    @Override
    public void close() {
        cleanup();
    }
}
