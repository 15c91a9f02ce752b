package com.ivyintel.tracker.scrape.model;

public enum InsertOutcome {
    INSERTED,
    DUPLICATE
}
