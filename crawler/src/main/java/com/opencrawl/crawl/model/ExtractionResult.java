package com.opencrawl.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ExtractionResult(
    ExtractionStrategy strategy,
    String content,
    Map<String, String> metadata,
    List<String> links,
    List<String> images
) {
    public ExtractionResult {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        links = links == null ? List.of() : List.copyOf(links);
        images = images == null ? List.of() : List.copyOf(images);
    }
}
