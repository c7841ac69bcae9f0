package com.opencrawl.crawl.output;

import com.opencrawl.crawl.model.CrawlResponse;
import com.opencrawl.crawl.model.ExtractionResult;

import java.util.List;
import java.util.Map;

/**
 * Flat, serialisable form of a {@link CrawlResponse}. {@code error} is null on success.
 */
public record CrawlResultView(
    String url,
    Integer status,
    String content,
    Map<String, String> metadata,
    List<String> links,
    List<String> images,
    String error
) {
    public static CrawlResultView from(CrawlResponse response) {
        ExtractionResult extracted = response.extracted();
        return new CrawlResultView(
            response.url(),
            response.statusCode(),
            extracted == null ? null : extracted.content(),
            extracted == null ? Map.of() : extracted.metadata(),
            extracted == null ? List.of() : extracted.links(),
            extracted == null ? List.of() : extracted.images(),
            response.error() == null ? null : response.error().describe()
        );
    }
}
