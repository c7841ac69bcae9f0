package com.opencrawl.crawl.model;

import java.util.Objects;

public record CrawlFailure(FailureKind kind, Integer statusCode, String message, int attempts) {
    public CrawlFailure {
        Objects.requireNonNull(kind, "kind");
        attempts = Math.max(0, attempts);
    }

    public static CrawlFailure of(FailureKind kind, String message, int attempts) {
        return new CrawlFailure(kind, null, message, attempts);
    }

    public String describe() {
        StringBuilder out = new StringBuilder(kind.name());
        if (statusCode != null) {
            out.append(" (").append(statusCode).append(')');
        }
        out.append(" after ").append(attempts).append(attempts == 1 ? " attempt" : " attempts");
        if (message != null && !message.isBlank()) {
            out.append(": ").append(message);
        }
        return out.toString();
    }
}
