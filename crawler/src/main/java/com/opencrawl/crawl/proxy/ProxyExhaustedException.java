package com.opencrawl.crawl.proxy;

public class ProxyExhaustedException extends RuntimeException {
    public ProxyExhaustedException(String message) {
        super(message);
    }
}
