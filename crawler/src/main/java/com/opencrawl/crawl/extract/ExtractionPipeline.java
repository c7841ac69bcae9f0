package com.opencrawl.crawl.extract;

import com.opencrawl.config.ExtractionSettings;
import com.opencrawl.crawl.model.ExtractionResult;
import com.opencrawl.crawl.model.ExtractionStrategy;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses raw HTML, cleans it and renders it with the requested {@link ExtractionStrategy}.
 * Stateless apart from its settings, so one instance is shared by all requests.
 */
public class ExtractionPipeline {
    static final int MAX_NESTING_DEPTH = 128;

    private final ExtractionSettings settings;
    private final Map<ExtractionStrategy, ContentRenderer> renderers = new EnumMap<>(ExtractionStrategy.class);
    private final HtmlCleaner cleaner = new HtmlCleaner();
    private final PageMetadataExtractor metadataExtractor = new PageMetadataExtractor();

    public ExtractionPipeline(ExtractionSettings settings) {
        this.settings = settings;
        renderers.put(ExtractionStrategy.HTML, new HtmlRenderer());
        renderers.put(ExtractionStrategy.CONTENT, new TextContentRenderer());
        renderers.put(ExtractionStrategy.MARKDOWN, new MarkdownRenderer());
    }

    public ExtractionResult extract(String html, String baseUrl) {
        return extract(html, baseUrl, settings.strategy());
    }

    /**
     * Metadata, links and images are read after tag stripping but before short blocks are
     * pruned, so they do not depend on {@code minTextLength} or on the strategy.
     *
     * @throws ExtractionException when the page cannot be parsed or rendered
     */
    public ExtractionResult extract(String html, String baseUrl, ExtractionStrategy strategy) {
        ExtractionStrategy effective = strategy == null ? settings.strategy() : strategy;
        try {
            String input = html == null ? "" : html;
            if (input.length() > settings.maxBodyBytes()) {
                input = input.substring(0, settings.maxBodyBytes());
            }
            Document document = Jsoup.parse(input, baseUrl == null ? "" : baseUrl);
            cleaner.strip(document, settings);

            Map<String, String> metadata = settings.extractMetadata() ? metadataExtractor.metadata(document) : Map.of();
            List<String> links = settings.extractLinks() ? metadataExtractor.links(document) : List.of();
            List<String> images = settings.extractImages() ? metadataExtractor.images(document) : List.of();

            cleaner.flattenDeepNesting(document, MAX_NESTING_DEPTH);
            cleaner.pruneShortBlocks(document, settings.minTextLength());
            String content = renderers.get(effective).render(document, settings);

            return new ExtractionResult(effective, content, metadata, links, images);
        } catch (RuntimeException | StackOverflowError e) {
            throw new ExtractionException("Extraction error: " + describe(e), e);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * True for content types the pipeline can parse; a missing type is assumed to be HTML.
     */
    public static boolean supportsContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.startsWith("text/") || lower.contains("html") || lower.contains("xml");
    }
}
