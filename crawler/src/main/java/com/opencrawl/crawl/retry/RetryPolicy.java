package com.opencrawl.crawl.retry;

import com.opencrawl.config.RetrySettings;
import com.opencrawl.crawl.model.CrawlFailure;
import com.opencrawl.crawl.model.FailureKind;

import java.time.Duration;

/**
 * Decides whether a failed attempt is tried again. {@code attemptIndex} is the zero-based
 * index of the attempt that just failed; the delay before the next attempt is
 * {@code min(maxDelay, baseDelay * backoffFactor^attemptIndex)}.
 */
public class RetryPolicy {
    private final RetrySettings settings;
    private final boolean sslVerify;

    public RetryPolicy(RetrySettings settings, boolean sslVerify) {
        this.settings = settings;
        this.sslVerify = sslVerify;
    }

    public RetryDecision decide(int attemptIndex, CrawlFailure failure) {
        return decide(attemptIndex, failure.kind(), failure.statusCode());
    }

    public RetryDecision decide(int attemptIndex, FailureKind kind, Integer statusCode) {
        if (attemptIndex + 1 >= settings.maxAttempts() || !isRetryable(kind, statusCode)) {
            return RetryDecision.stop();
        }
        return RetryDecision.retryAfter(delayFor(attemptIndex));
    }

    public boolean isRetryable(FailureKind kind, Integer statusCode) {
        return switch (kind) {
            case CONNECTION_FAILURE, DNS_FAILURE, TIMEOUT, PROXY_FAILURE -> true;
            case HTTP_STATUS -> statusCode != null && statusCode >= 500;
            case SSL_VERIFICATION -> !sslVerify;
            case REDIRECT_LIMIT_EXCEEDED, PROXY_EXHAUSTION, MALFORMED_URL, EXTRACTION_FAILURE, CANCELLED -> false;
        };
    }

    Duration delayFor(int attemptIndex) {
        long baseMs = settings.baseDelay().toMillis();
        long maxMs = settings.maxDelay().toMillis();
        double scaled = baseMs * Math.pow(settings.backoffFactor(), Math.max(0, attemptIndex));
        if (Double.isInfinite(scaled) || scaled >= maxMs) {
            return Duration.ofMillis(maxMs);
        }
        return Duration.ofMillis(Math.round(scaled));
    }
}
