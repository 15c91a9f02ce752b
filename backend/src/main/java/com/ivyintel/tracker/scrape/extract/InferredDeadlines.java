package com.ivyintel.tracker.scrape.extract;

/**
 * Coarse co-occurrence hints. These are not parsed dates.
 */
public record InferredDeadlines(String early, String regular) {}
