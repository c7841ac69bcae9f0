package com.opencrawl.crawl.extract;

import com.opencrawl.config.ExtractionSettings;
import com.opencrawl.crawl.util.UrlUtils;
import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.html2md.converter.LinkConversion;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * Converts the main region of a cleaned document to markdown with flexmark. Links and images
 * are written as markdown only when their extraction toggle is on; otherwise only their text
 * remains. Rewrites URLs in the given document to absolute form.
 */
class MarkdownRenderer implements ContentRenderer {
    private final FlexmarkHtmlConverter[] converters = new FlexmarkHtmlConverter[4];

    MarkdownRenderer() {
        for (int i = 0; i < converters.length; i++) {
            converters[i] = buildConverter((i & 1) != 0, (i & 2) != 0);
        }
    }

    @Override
    public String render(Document cleaned, ExtractionSettings settings) {
        Element region = TextBlocks.mainRegion(cleaned);
        if (region == null) {
            return "";
        }
        absolutizeLinks(region);
        absolutizeImages(region);
        String markdown = converterFor(settings).convert(region.outerHtml());
        return markdown.replaceAll("\n{3,}", "\n\n").strip();
    }

    private FlexmarkHtmlConverter converterFor(ExtractionSettings settings) {
        return converters[(settings.extractLinks() ? 1 : 0) | (settings.extractImages() ? 2 : 0)];
    }

    private static FlexmarkHtmlConverter buildConverter(boolean links, boolean images) {
        MutableDataSet options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        options.set(FlexmarkHtmlConverter.UNORDERED_LIST_DELIMITER, '-');
        options.set(FlexmarkHtmlConverter.DIV_AS_PARAGRAPH, true);
        options.set(FlexmarkHtmlConverter.EXT_INLINE_LINK, links ? LinkConversion.MARKDOWN_EXPLICIT : LinkConversion.TEXT);
        options.set(FlexmarkHtmlConverter.EXT_INLINE_IMAGE, images ? LinkConversion.MARKDOWN_EXPLICIT : LinkConversion.TEXT);
        return FlexmarkHtmlConverter.builder(options).build();
    }

    // Anchors that do not point at an http(s) page keep only their text.
    private static void absolutizeLinks(Element root) {
        for (Element anchor : root.select("a")) {
            String href = anchor.absUrl("href");
            if (UrlUtils.isHttpLike(href)) {
                anchor.attr("href", href);
            } else {
                anchor.unwrap();
            }
        }
    }

    // Images without an http(s) source are replaced by their alt text.
    private static void absolutizeImages(Element root) {
        for (Element img : root.select("img")) {
            String src = img.absUrl("src");
            if (UrlUtils.isHttpLike(src)) {
                img.attr("src", src);
            } else {
                img.replaceWith(new TextNode(TextBlocks.normalize(img.attr("alt"))));
            }
        }
    }
}
