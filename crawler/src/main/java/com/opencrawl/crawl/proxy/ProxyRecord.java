package com.opencrawl.crawl.proxy;

import com.opencrawl.crawl.model.ProxyHealth;

import java.time.Duration;
import java.time.Instant;

/**
 * Health state of one proxy. Only {@link ProxyPool} mutates it; every read-modify-write of
 * the counters happens under this record's monitor.
 */
public final class ProxyRecord {
    private final ProxyAddress address;
    private volatile ProxyHealth health = ProxyHealth.UNVALIDATED;
    private int consecutiveFailures;
    private Instant lastValidatedAt;

    ProxyRecord(ProxyAddress address) {
        this.address = address;
    }

    public ProxyAddress address() {
        return address;
    }

    public ProxyHealth health() {
        return health;
    }

    public boolean isHealthy() {
        return health == ProxyHealth.HEALTHY;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    synchronized boolean needsValidation(Instant now, Duration maxAge) {
        if (health != ProxyHealth.HEALTHY || lastValidatedAt == null) {
            return true;
        }
        return !lastValidatedAt.plus(maxAge).isAfter(now);
    }

    synchronized void markValidated(boolean passed, Instant at) {
        lastValidatedAt = at;
        if (passed) {
            consecutiveFailures = 0;
            health = ProxyHealth.HEALTHY;
        } else {
            health = ProxyHealth.UNHEALTHY;
        }
    }

    /**
     * @return true when this failure demoted the proxy
     */
    synchronized boolean recordFailure(int threshold) {
        consecutiveFailures++;
        if (health == ProxyHealth.HEALTHY && consecutiveFailures >= threshold) {
            health = ProxyHealth.UNHEALTHY;
            return true;
        }
        return false;
    }

    synchronized void recordSuccess() {
        consecutiveFailures = 0;
    }

    public synchronized ProxyStatus status() {
        return new ProxyStatus(address.url(), health, consecutiveFailures, lastValidatedAt);
    }

    @Override
    public String toString() {
        return address.url();
    }
}
