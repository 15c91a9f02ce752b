package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cost-of-attendance tables plus labelled dollar amounts found in the page text.
 */
public class FeesExtractor {
    static final String NOTE =
        "Fees extracted from official page text/tables; values can vary by year/program. Verify on the official page.";
    private static final int MAX_TABLES = 3;
    private static final int MAX_ROWS = 25;
    private static final int MIN_CATEGORIES_FOR_TOTAL = 3;
    // Label and amount must sit in the same stretch of text with no other dollar sign between them.
    private static final String AMOUNT_WINDOW = "[^$]{0,120}?\\$\\s*([0-9][0-9,]*)";

    private static final Pattern TUITION = label("Tuition");
    private static final Pattern FEES = label("Fees");
    private static final Pattern HOUSING = label("Housing|Room");
    private static final Pattern FOOD = label("Food|Board|Meal");
    private static final Pattern BOOKS = label("Books");
    private static final Pattern TRAVEL = label("Travel|Transportation");
    private static final Pattern PERSONAL = label("Personal");

    public FeesRecord extract(Document document) {
        String text = HtmlText.visibleText(document);
        FeeSummary summary = new FeeSummary(
            findAmount(TUITION, text),
            findAmount(FEES, text),
            findAmount(HOUSING, text),
            findAmount(FOOD, text),
            findAmount(BOOKS, text),
            findAmount(TRAVEL, text),
            findAmount(PERSONAL, text)
        );
        return new FeesRecord(summary, estimateTotal(summary), extractTables(document), NOTE);
    }

    List<List<List<String>>> extractTables(Document document) {
        List<List<List<String>>> tables = new ArrayList<>();
        List<Element> tableElements = document.select("table");
        for (Element table : tableElements.subList(0, Math.min(MAX_TABLES, tableElements.size()))) {
            List<Element> rowElements = table.select("tr");
            List<List<String>> rows = new ArrayList<>();
            for (Element tr : rowElements.subList(0, Math.min(MAX_ROWS, rowElements.size()))) {
                List<String> row = new ArrayList<>();
                for (Element cell : tr.select("th, td")) {
                    String value = HtmlText.text(cell);
                    if (!value.isEmpty()) {
                        row.add(value);
                    }
                }
                if (!row.isEmpty()) {
                    rows.add(List.copyOf(row));
                }
            }
            if (!rows.isEmpty()) {
                tables.add(List.copyOf(rows));
            }
        }
        return List.copyOf(tables);
    }

    /**
     * Naive sum of the resolved categories. Only a rough hint: categories may overlap or cover different periods.
     */
    String estimateTotal(FeeSummary summary) {
        List<String> amounts = summary.resolvedAmounts();
        if (amounts.size() < MIN_CATEGORIES_FOR_TOTAL) {
            return null;
        }
        long total = 0;
        for (String amount : amounts) {
            total += Long.parseLong(amount.substring(1).replace(",", ""));
        }
        return String.format(Locale.US, "$%,d", total);
    }

    private String findAmount(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group(1);
        while (digits.endsWith(",")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        if (digits.replace(",", "").length() > 15) {
            return null;
        }
        return "$" + digits;
    }

    private static Pattern label(String alternatives) {
        return Pattern.compile("(?:" + alternatives + ")" + AMOUNT_WINDOW, Pattern.CASE_INSENSITIVE);
    }
}
