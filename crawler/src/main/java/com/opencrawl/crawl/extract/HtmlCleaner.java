package com.opencrawl.crawl.extract;

import com.opencrawl.config.ExtractionSettings;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Removes boilerplate from a parsed document in place. Tag stripping and short-block
 * pruning are separate steps so that links and images can be collected in between.
 */
class HtmlCleaner {
    // Table cells are kept so that rows keep their shape.
    private static final Set<String> PRUNABLE_TAGS = Set.of(
        "p", "h1", "h2", "h3", "h4", "h5", "h6", "li", "dt", "dd", "blockquote", "pre",
        "figcaption", "caption", "div", "section", "address", "summary"
    );

    void strip(Document document, ExtractionSettings settings) {
        if (settings.stripScripts()) {
            document.select("script, noscript").remove();
        }
        if (settings.stripStyles()) {
            document.select("style, link[rel=stylesheet]").remove();
        }
        if (settings.stripComments()) {
            removeComments(document);
        }
        if (settings.stripNav()) {
            document.select("nav, [role=navigation]").remove();
        }
        if (settings.stripHeaders()) {
            document.select("body header, [role=banner]").remove();
        }
        if (settings.stripFooters()) {
            document.select("footer, [role=contentinfo]").remove();
        }
    }

    /**
     * Replaces the children of every element sitting {@code maxDepth} levels below the
     * document root with their text, so that later tree walks have bounded depth.
     */
    void flattenDeepNesting(Document document, int maxDepth) {
        List<Element> boundary = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (depth == maxDepth && node instanceof Element element && element.childrenSize() > 0) {
                boundary.add(element);
            }
        }, document);
        for (Element element : boundary) {
            String text = element.text();
            element.empty().appendText(text);
        }
    }

    private void removeComments(Document document) {
        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Comment) {
                comments.add(node);
            }
        }, document);
        comments.forEach(Node::remove);
    }

    /**
     * Drops leaf text blocks whose text is shorter than {@code minLength}. Blocks that hold
     * media or other blocks are kept.
     */
    void pruneShortBlocks(Document document, int minLength) {
        Element body = document.body();
        if (body == null || minLength <= 0) {
            return;
        }
        List<Element> doomed = new ArrayList<>();
        for (Element element : body.getAllElements()) {
            if (!PRUNABLE_TAGS.contains(element.normalName()) || !isLeafBlock(element)) {
                continue;
            }
            int length = TextBlocks.normalize(element.text()).length();
            if (length > 0 && length < minLength) {
                doomed.add(element);
            }
        }
        doomed.forEach(Element::remove);
    }

    private boolean isLeafBlock(Element element) {
        for (Element descendant : element.getAllElements()) {
            if (descendant == element) {
                continue;
            }
            if (TextBlocks.isBlock(descendant) || TextBlocks.MEDIA_TAGS.contains(descendant.normalName())) {
                return false;
            }
        }
        return true;
    }
}
