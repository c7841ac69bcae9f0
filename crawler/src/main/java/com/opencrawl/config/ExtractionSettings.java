package com.opencrawl.config;

import com.opencrawl.crawl.model.ExtractionStrategy;

public record ExtractionSettings(
    ExtractionStrategy strategy,
    boolean stripScripts,
    boolean stripStyles,
    boolean stripComments,
    boolean stripNav,
    boolean stripHeaders,
    boolean stripFooters,
    int minTextLength,
    boolean extractMetadata,
    boolean extractLinks,
    boolean extractImages,
    int maxBodyBytes
) {
    public static final int MIN_BODY_BYTES = 1024;

    public ExtractionSettings {
        strategy = strategy == null ? ExtractionStrategy.CONTENT : strategy;
        minTextLength = Math.max(0, minTextLength);
        maxBodyBytes = Math.max(MIN_BODY_BYTES, maxBodyBytes);
    }
}
