package com.opencrawl.config;

import com.opencrawl.crawl.model.ExtractionStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("OpenCrawl/0.1"));
    }

    @Test
    void concurrencyAndRetryKnobsAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxConcurrentRequests(0);
        properties.getRetry().setMaxAttempts(0);
        properties.getRetry().setBaseDelayMs(-10);
        properties.getRetry().setBackoffFactor(0.5);
        assertEquals(1, properties.getMaxConcurrentRequests());
        assertEquals(1, properties.getRetry().getMaxAttempts());
        assertEquals(0, properties.getRetry().getBaseDelayMs());
        assertEquals(1.0, properties.getRetry().getBackoffFactor());
    }

    @Test
    void workerThreadsDefaultToConcurrencyLimit() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxConcurrentRequests(7);
        assertEquals(7, properties.getWorkerThreads());
        properties.setWorkerThreads(3);
        assertEquals(3, properties.getWorkerThreads());
    }

    @Test
    void defaultsCarryIntoImmutableConfig() {
        CrawlerConfig config = CrawlerConfig.defaults();
        assertEquals(5, config.maxConcurrentRequests());
        assertEquals(Duration.ofSeconds(30), config.requestTimeout());
        assertEquals("OpenCrawl/0.1.0", config.userAgent());
        assertTrue(config.sslVerify());
        assertEquals(10, config.maxRedirects());
        assertEquals(3, config.retry().maxAttempts());
        assertEquals(Duration.ofSeconds(1), config.retry().baseDelay());
        assertEquals(Duration.ofSeconds(30), config.retry().maxDelay());
        assertEquals(3, config.proxy().failureThreshold());
        assertEquals(ExtractionStrategy.CONTENT, config.extraction().strategy());
        assertEquals(10, config.extraction().minTextLength());
        assertTrue(config.extraction().extractLinks());
    }

    @Test
    void laterPropertyChangesDoNotLeakIntoBuiltConfig() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getDefaultHeaders().put("X-Trace", "1");
        CrawlerConfig config = properties.toConfig();
        properties.getDefaultHeaders().put("X-Other", "2");
        assertEquals(1, config.defaultHeaders().size());
    }
}
