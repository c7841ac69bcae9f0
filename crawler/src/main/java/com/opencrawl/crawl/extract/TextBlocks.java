package com.opencrawl.crawl.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class TextBlocks {
    static final Set<String> BLOCK_TAGS = Set.of(
        "html", "body", "main", "article", "section", "aside", "header", "footer", "nav",
        "div", "p", "h1", "h2", "h3", "h4", "h5", "h6", "ul", "ol", "li", "dl", "dt", "dd",
        "table", "thead", "tbody", "tfoot", "tr", "td", "th", "caption", "blockquote", "pre",
        "figure", "figcaption", "form", "fieldset", "address", "hr", "details", "summary"
    );
    static final Set<String> MEDIA_TAGS = Set.of("img", "picture", "video", "audio", "iframe", "svg", "object", "embed");

    private TextBlocks() {
    }

    static boolean isBlock(Element element) {
        return BLOCK_TAGS.contains(element.normalName());
    }

    /**
     * {@code main}, else {@code article}, else {@code body}.
     */
    static Element mainRegion(Document document) {
        Element main = document.selectFirst("main");
        if (main != null) {
            return main;
        }
        Element article = document.selectFirst("article");
        if (article != null) {
            return article;
        }
        return document.body();
    }

    /**
     * Splits the text under {@code root} at block boundaries, in document order. Each entry
     * has its whitespace collapsed; empty runs are skipped.
     */
    static List<String> collect(Element root) {
        List<String> blocks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode text) {
                    current.append(text.getWholeText());
                } else if (node instanceof Element element) {
                    if (isBlock(element)) {
                        flush(current, blocks);
                    } else if (element.normalName().equals("br")) {
                        current.append(' ');
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && isBlock(element)) {
                    flush(current, blocks);
                }
            }
        }, root);
        flush(current, blocks);
        return blocks;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u00a0', ' ').replaceAll("\\s+", " ").strip();
    }

    private static void flush(StringBuilder current, List<String> blocks) {
        String text = normalize(current.toString());
        if (!text.isEmpty()) {
            blocks.add(text);
        }
        current.setLength(0);
    }
}
