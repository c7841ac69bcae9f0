package com.opencrawl.crawl.model;

public enum FailureKind {
    CONNECTION_FAILURE,
    DNS_FAILURE,
    TIMEOUT,
    HTTP_STATUS,
    REDIRECT_LIMIT_EXCEEDED,
    SSL_VERIFICATION,
    PROXY_FAILURE,
    PROXY_EXHAUSTION,
    MALFORMED_URL,
    EXTRACTION_FAILURE,
    CANCELLED;

    /**
     * Failures that say something about the egress route rather than the target page.
     */
    public boolean isNetworkLevel() {
        return switch (this) {
            case CONNECTION_FAILURE, DNS_FAILURE, TIMEOUT, PROXY_FAILURE -> true;
            default -> false;
        };
    }
}
