package com.opencrawl.crawl.model;

public enum ProxyHealth {
    UNVALIDATED,
    HEALTHY,
    UNHEALTHY
}
