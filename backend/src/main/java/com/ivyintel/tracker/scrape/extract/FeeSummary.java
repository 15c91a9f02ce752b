package com.ivyintel.tracker.scrape.extract;

import java.util.ArrayList;
import java.util.List;

public record FeeSummary(
    String tuition,
    String fees,
    String housing,
    String food,
    String books,
    String travel,
    String personal
) {
    public List<String> resolvedAmounts() {
        List<String> amounts = new ArrayList<>();
        for (String value : new String[] {tuition, fees, housing, food, books, travel, personal}) {
            if (value != null) {
                amounts.add(value);
            }
        }
        return amounts;
    }
}
