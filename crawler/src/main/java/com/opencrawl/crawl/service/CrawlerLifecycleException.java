package com.opencrawl.crawl.service;

public class CrawlerLifecycleException extends RuntimeException {
    public CrawlerLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
