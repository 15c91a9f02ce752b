package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the first substantive paragraphs, skipping short navigation text and long legal blocks.
 */
public class ParagraphSummaryExtractor {
    static final String AID_NOTE =
        "Financial aid summary extracted from top paragraphs. Use official page for details.";
    static final String ABOUT_NOTE =
        "About/overview extracted from top paragraphs. Use official page for details.";
    private static final int MAX_PARAGRAPHS = 4;

    public AidRecord extractAid(Document document) {
        return new AidRecord(paragraphs(document, MAX_PARAGRAPHS), AID_NOTE);
    }

    public AboutRecord extractAbout(Document document) {
        return new AboutRecord(paragraphs(document, MAX_PARAGRAPHS), ABOUT_NOTE);
    }

    List<String> paragraphs(Document document, int maxParagraphs) {
        List<String> out = new ArrayList<>();
        for (Element paragraph : document.select("p")) {
            if (out.size() >= maxParagraphs) {
                break;
            }
            String text = HtmlText.text(paragraph);
            if (HtmlText.lengthBetween(text, 60, 350)) {
                out.add(text);
            }
        }
        return List.copyOf(out);
    }
}
