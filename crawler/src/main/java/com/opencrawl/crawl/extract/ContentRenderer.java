package com.opencrawl.crawl.extract;

import com.opencrawl.config.ExtractionSettings;
import org.jsoup.nodes.Document;

/**
 * Produces the content string of one {@link com.opencrawl.crawl.model.ExtractionStrategy}
 * from an already cleaned document.
 */
@FunctionalInterface
public interface ContentRenderer {
    String render(Document cleaned, ExtractionSettings settings);
}
