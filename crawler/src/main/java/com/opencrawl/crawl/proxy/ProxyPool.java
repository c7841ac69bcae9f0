package com.opencrawl.crawl.proxy;

import com.opencrawl.config.ProxySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Candidate egress proxies with health tracking and round-robin selection. An empty pool
 * runs in pass-through mode: {@link #acquire()} returns empty and requests go direct.
 */
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);
    private static final int MAX_PROBE_THREADS = 8;

    private final List<ProxyRecord> records;
    private final ProxyProbe probe;
    private final int failureThreshold;
    private final Duration revalidateAfter;
    private final Clock clock;
    private final AtomicInteger cursor = new AtomicInteger();

    public ProxyPool(List<ProxyAddress> addresses, ProxyProbe probe, int failureThreshold, Duration revalidateAfter) {
        this(addresses, probe, failureThreshold, revalidateAfter, Clock.systemUTC());
    }

    ProxyPool(
        List<ProxyAddress> addresses,
        ProxyProbe probe,
        int failureThreshold,
        Duration revalidateAfter,
        Clock clock
    ) {
        List<ProxyRecord> built = new ArrayList<>();
        for (ProxyAddress address : addresses) {
            built.add(new ProxyRecord(address));
        }
        this.records = List.copyOf(built);
        this.probe = probe;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.revalidateAfter = revalidateAfter == null ? Duration.ZERO : revalidateAfter;
        this.clock = clock;
    }

    public static ProxyPool fromSettings(ProxySettings settings, ProxyProbe probe) {
        return new ProxyPool(
            ProxySourceLoader.load(settings),
            probe,
            settings.failureThreshold(),
            settings.revalidateAfter()
        );
    }

    public static ProxyPool passThrough() {
        return new ProxyPool(List.of(), proxy -> true, 1, Duration.ZERO);
    }

    public boolean isPassThrough() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    public int healthyCount() {
        int healthy = 0;
        for (ProxyRecord record : records) {
            if (record.isHealthy()) {
                healthy++;
            }
        }
        return healthy;
    }

    public List<ProxyStatus> snapshot() {
        return records.stream().map(ProxyRecord::status).toList();
    }

    public void validateAll() {
        if (records.isEmpty()) {
            return;
        }
        ExecutorService probeExecutor = Executors.newFixedThreadPool(Math.min(MAX_PROBE_THREADS, records.size()));
        try {
            validateAll(probeExecutor);
        } finally {
            probeExecutor.shutdownNow();
        }
    }

    /**
     * Probes every unvalidated, unhealthy or stale proxy, running the probes on
     * {@code executor}, and waits for all of them.
     */
    public void validateAll(Executor executor) {
        List<ProxyRecord> candidates = records.stream()
            .filter(record -> record.needsValidation(clock.instant(), revalidateAfter))
            .toList();
        if (candidates.isEmpty()) {
            return;
        }
        log.info("Checking {} proxies...", candidates.size());
        List<CompletableFuture<Void>> probes = new ArrayList<>();
        for (ProxyRecord record : candidates) {
            probes.add(CompletableFuture.runAsync(() -> validate(record), executor));
        }
        CompletableFuture.allOf(probes.toArray(new CompletableFuture[0])).join();
        log.info("Proxy validation finished: {}/{} healthy", healthyCount(), records.size());
    }

    private void validate(ProxyRecord record) {
        boolean passed;
        try {
            passed = probe.probe(record.address());
        } catch (RuntimeException e) {
            log.warn("Proxy probe for {} threw", record, e);
            passed = false;
        }
        record.markValidated(passed, clock.instant());
    }

    /**
     * @return a healthy proxy, or empty in pass-through mode
     * @throws ProxyExhaustedException when proxies are configured but none is healthy
     */
    public Optional<ProxyRecord> acquire() {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        List<ProxyRecord> healthy = records.stream().filter(ProxyRecord::isHealthy).toList();
        if (healthy.isEmpty()) {
            throw new ProxyExhaustedException("No healthy proxy among " + records.size() + " configured");
        }
        int index = Math.floorMod(cursor.getAndIncrement(), healthy.size());
        return Optional.of(healthy.get(index));
    }

    public void reportFailure(ProxyRecord record) {
        if (record == null) {
            return;
        }
        if (record.recordFailure(failureThreshold)) {
            log.warn(
                "Proxy {} marked unhealthy after {} consecutive failures",
                record,
                record.consecutiveFailures()
            );
        }
    }

    public void reportSuccess(ProxyRecord record) {
        if (record != null) {
            record.recordSuccess();
        }
    }
}
