package com.opencrawl.crawl.model;

public enum ExtractionStrategy {
    HTML,
    CONTENT,
    MARKDOWN
}
