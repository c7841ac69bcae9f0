package com.opencrawl.crawl.proxy;

@FunctionalInterface
public interface ProxyProbe {
    /**
     * @return true when a test request through the proxy succeeded
     */
    boolean probe(ProxyAddress proxy);
}
