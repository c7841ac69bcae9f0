package com.opencrawl.crawl.retry;

import java.time.Duration;

public record RetryDecision(boolean retry, Duration delay) {
    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }

    public static RetryDecision stop() {
        return STOP;
    }
}
