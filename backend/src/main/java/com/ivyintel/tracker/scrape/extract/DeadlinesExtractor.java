package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.jsoup.nodes.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deadline-looking lines. The inferred buckets are co-occurrence hints, never parsed dates.
 */
public class DeadlinesExtractor {
    static final String NOTE =
        "Deadlines extracted from lines containing date/deadline keywords. Confirm on official page.";
    static final String EARLY_HINT = "Likely around Nov (check official page)";
    static final String REGULAR_HINT = "Likely around Jan (check official page)";
    private static final int MAX_LINES = 25;
    private static final String MONTHS =
        "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|jun(?:e)?|jul(?:y)?|aug(?:ust)?"
            + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";
    private static final Pattern MONTH_DAY = Pattern.compile(MONTHS + "\\s+\\d{1,2}\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> DEADLINE_KEYWORDS = List.of(
        "deadline",
        "early",
        "regular",
        "decision",
        "single-choice",
        "financial aid",
        "questbridge",
        "due"
    );
    private static final List<String> MONTH_ABBREVIATIONS = List.of(
        "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec"
    );

    public DeadlinesRecord extract(Document document) {
        List<String> lines = HtmlText.lines(document);

        List<String> highlights = new ArrayList<>();
        List<String> dateLines = new ArrayList<>();
        for (String line : lines) {
            boolean hasMonthDay = MONTH_DAY.matcher(line).find();
            if (HtmlText.lengthBetween(line, 10, 240)
                && HtmlText.containsAny(line, DEADLINE_KEYWORDS)
                && (hasMonthDay || HtmlText.containsAny(line, MONTH_ABBREVIATIONS))) {
                highlights.add(line);
            }
            if (hasMonthDay && HtmlText.lengthBetween(line, 10, 200)) {
                dateLines.add(line);
            }
        }

        return new DeadlinesRecord(
            HtmlText.dedupe(highlights, MAX_LINES),
            HtmlText.dedupe(dateLines, MAX_LINES),
            inferBuckets(lines),
            NOTE
        );
    }

    InferredDeadlines inferBuckets(List<String> lines) {
        String joined = String.join(" | ", lines).toLowerCase(Locale.ROOT);
        String early = joined.contains("nov") && joined.contains("early") ? EARLY_HINT : null;
        String regular = joined.contains("jan") && joined.contains("regular") ? REGULAR_HINT : null;
        return new InferredDeadlines(early, regular);
    }
}
