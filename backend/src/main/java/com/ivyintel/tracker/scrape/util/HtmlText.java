package com.ivyintel.tracker.scrape.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Null-tolerant helpers shared by the extractors for turning markup into comparable text.
 */
public final class HtmlText {
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private HtmlText() {
    }

    public static Document parse(String html) {
        return Jsoup.parse(html == null ? "" : html);
    }

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String text(Element element) {
        return element == null ? "" : clean(element.text());
    }

    public static String visibleText(Document document) {
        return clean(document.text());
    }

    /**
     * Visible text broken at block boundaries and source line breaks, trimmed, blank lines dropped.
     */
    public static List<String> lines(Document document) {
        StringBuilder raw = new StringBuilder();
        document.body().traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    raw.append(textNode.getWholeText());
                } else if (node instanceof Element element && breaksLine(element)) {
                    raw.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && breaksLine(element)) {
                    raw.append('\n');
                }
            }
        });

        List<String> out = new ArrayList<>();
        for (String line : LINE_BREAK.split(raw)) {
            String cleaned = clean(line);
            if (!cleaned.isEmpty()) {
                out.add(cleaned);
            }
        }
        return out;
    }

    public static boolean lengthBetween(String value, int min, int max) {
        int length = value.length();
        return length >= min && length <= max;
    }

    public static boolean containsAny(String value, Collection<String> keywords) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static List<String> dedupe(List<String> items, int limit) {
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        for (String item : items) {
            if (seen.size() >= limit) {
                break;
            }
            seen.add(item);
        }
        return List.copyOf(seen);
    }

    private static boolean breaksLine(Element element) {
        return element.isBlock() || "br".equals(element.normalName());
    }
}
