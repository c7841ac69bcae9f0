package com.opencrawl.crawl.service;

import java.util.concurrent.Semaphore;

/**
 * Caps the number of requests in flight. A request holds one permit from before its first
 * attempt until its response is built.
 */
public final class ConcurrencyGate {
    private final Semaphore permits;
    private final int capacity;

    public ConcurrencyGate(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.permits = new Semaphore(this.capacity);
    }

    public Permit acquire() throws InterruptedException {
        permits.acquire();
        return permits::release;
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return permits.availablePermits();
    }

    public interface Permit extends AutoCloseable {
        @Override
        void close();
    }
}
