package com.opencrawl.crawl.extract;

import com.opencrawl.config.ExtractionSettings;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Visible text of the main region, one block per paragraph-like element, separated by a
 * blank line.
 */
class TextContentRenderer implements ContentRenderer {
    @Override
    public String render(Document cleaned, ExtractionSettings settings) {
        List<String> blocks = TextBlocks.collect(TextBlocks.mainRegion(cleaned)).stream()
            .filter(block -> block.length() >= settings.minTextLength())
            .toList();
        return String.join("\n\n", blocks);
    }
}
