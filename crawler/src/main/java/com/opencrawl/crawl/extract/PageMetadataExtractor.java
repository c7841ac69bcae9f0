package com.opencrawl.crawl.extract;

import com.opencrawl.crawl.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

class PageMetadataExtractor {
    private static final Map<String, String> META_SELECTORS = orderedSelectors();

    private static Map<String, String> orderedSelectors() {
        Map<String, String> selectors = new LinkedHashMap<>();
        selectors.put("description", "meta[name=description]");
        selectors.put("keywords", "meta[name=keywords]");
        selectors.put("author", "meta[name=author]");
        selectors.put("og:title", "meta[property=og:title]");
        selectors.put("og:description", "meta[property=og:description]");
        selectors.put("og:image", "meta[property=og:image]");
        return selectors;
    }

    Map<String, String> metadata(Document document) {
        Map<String, String> metadata = new LinkedHashMap<>();
        Element title = document.selectFirst("title");
        if (title != null) {
            String text = TextBlocks.normalize(title.text());
            if (!text.isEmpty()) {
                metadata.put("title", text);
            }
        }
        for (Map.Entry<String, String> entry : META_SELECTORS.entrySet()) {
            Element tag = document.selectFirst(entry.getValue());
            if (tag == null) {
                continue;
            }
            String content = tag.attr("content").strip();
            if (!content.isEmpty()) {
                metadata.put(entry.getKey(), content);
            }
        }
        return metadata;
    }

    List<String> links(Document document) {
        return absoluteUrls(document, "a[href]", "href");
    }

    List<String> images(Document document) {
        return absoluteUrls(document, "img[src]", "src");
    }

    private List<String> absoluteUrls(Document document, String selector, String attribute) {
        Set<String> urls = new LinkedHashSet<>();
        for (Element element : document.select(selector)) {
            String resolved = element.absUrl(attribute);
            if (UrlUtils.isHttpLike(resolved)) {
                urls.add(resolved);
            }
        }
        return new ArrayList<>(urls);
    }
}
