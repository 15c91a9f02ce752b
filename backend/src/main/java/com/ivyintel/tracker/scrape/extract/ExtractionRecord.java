package com.ivyintel.tracker.scrape.extract;

/**
 * Structured facts pulled from one page. Every record carries a provenance disclaimer.
 */
public interface ExtractionRecord {
    String note();
}
