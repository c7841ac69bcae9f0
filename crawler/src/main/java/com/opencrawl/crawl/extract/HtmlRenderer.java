package com.opencrawl.crawl.extract;

import com.opencrawl.config.ExtractionSettings;
import org.jsoup.nodes.Document;

class HtmlRenderer implements ContentRenderer {
    @Override
    public String render(Document cleaned, ExtractionSettings settings) {
        return cleaned.outerHtml();
    }
}
