package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

public class ProgramsExtractor {
    static final String NOTE =
        "Programs extracted from link/list texts and filtered heuristically. Official catalogs are the source of truth.";
    private static final int MAX_PROGRAMS = 120;
    private static final List<String> NAVIGATION_WORDS = List.of(
        "apply", "admission", "financial", "contact", "login", "search", "privacy", "cookie", "menu"
    );
    private static final List<String> DISCIPLINE_KEYWORDS = List.of(
        "studies",
        "engineering",
        "science",
        "mathematics",
        "history",
        "economics",
        "biology",
        "computer",
        "physics",
        "chemistry",
        "philosophy",
        "political",
        "sociology",
        "psychology",
        "language",
        "literature",
        "art",
        "music",
        "anthropology"
    );

    public ProgramsRecord extract(Document document) {
        List<String> candidates = new ArrayList<>();
        for (Element link : document.select("a")) {
            String text = HtmlText.text(link);
            if (HtmlText.lengthBetween(text, 3, 60) && !HtmlText.containsAny(text, NAVIGATION_WORDS)) {
                candidates.add(text);
            }
        }
        for (Element item : document.select("li")) {
            String text = HtmlText.text(item);
            if (HtmlText.lengthBetween(text, 3, 80)) {
                candidates.add(text);
            }
        }

        List<String> programs = new ArrayList<>();
        for (String candidate : candidates) {
            if (HtmlText.containsAny(candidate, DISCIPLINE_KEYWORDS)) {
                programs.add(candidate);
            }
        }
        List<String> unique = HtmlText.dedupe(programs, MAX_PROGRAMS);
        return new ProgramsRecord(unique, unique.size(), NOTE);
    }
}
