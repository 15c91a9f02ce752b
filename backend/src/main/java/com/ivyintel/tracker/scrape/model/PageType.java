package com.ivyintel.tracker.scrape.model;

import java.util.Locale;
import java.util.Optional;

public enum PageType {
    FEES("fees"),
    ADMISSIONS("admissions"),
    DEADLINES("deadlines"),
    PROGRAMS("programs"),
    AID("aid"),
    ABOUT("about");

    private final String key;

    PageType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<PageType> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PageType type : values()) {
            if (type.key.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
