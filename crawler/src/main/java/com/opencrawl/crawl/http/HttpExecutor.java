package com.opencrawl.crawl.http;

import com.opencrawl.crawl.model.HttpFetchResult;

/**
 * Performs single HTTP exchanges. Implementations never throw for network or protocol
 * failures; they report them through {@link HttpFetchResult#failureKind()}.
 */
public interface HttpExecutor extends AutoCloseable {

    /** Acquires connection resources. Called once before the first {@link #execute}. */
    default void open() {
    }

    HttpFetchResult execute(ResolvedRequest request);

    @Override
    default void close() {
    }
}
