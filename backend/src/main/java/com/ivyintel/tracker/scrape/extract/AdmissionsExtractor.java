package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

public class AdmissionsExtractor {
    static final String NOTE =
        "Admissions requirements are extracted from headings/bullets. Always verify on the official admissions page.";
    private static final int MAX_HEADINGS = 30;
    private static final int MAX_REQUIREMENTS = 40;
    private static final List<String> REQUIREMENT_KEYWORDS = List.of(
        "recommend",
        "required",
        "requirement",
        "years",
        "transcript",
        "essay",
        "teacher",
        "recommendation",
        "testing",
        "sat",
        "act"
    );

    public AdmissionsRecord extract(Document document) {
        List<String> headings = new ArrayList<>();
        for (Element heading : document.select("h1, h2, h3")) {
            if (headings.size() >= MAX_HEADINGS) {
                break;
            }
            String text = HtmlText.text(heading);
            if (!text.isEmpty()) {
                headings.add(text);
            }
        }

        List<String> requirements = new ArrayList<>();
        for (Element item : document.select("li")) {
            String text = HtmlText.text(item);
            if (HtmlText.lengthBetween(text, 20, 220) && HtmlText.containsAny(text, REQUIREMENT_KEYWORDS)) {
                requirements.add(text);
            }
        }

        return new AdmissionsRecord(List.copyOf(headings), HtmlText.dedupe(requirements, MAX_REQUIREMENTS), NOTE);
    }
}
