package com.opencrawl.crawl.proxy;

import com.opencrawl.crawl.model.ProxyHealth;

import java.time.Instant;

public record ProxyStatus(String proxy, ProxyHealth health, int consecutiveFailures, Instant lastValidatedAt) {
}
