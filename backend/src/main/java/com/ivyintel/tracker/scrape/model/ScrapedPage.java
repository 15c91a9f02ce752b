package com.ivyintel.tracker.scrape.model;

/**
 * A fetched, fingerprinted and extracted page that has not yet been reconciled against storage.
 */
public record ScrapedPage(
    Source source,
    String finalUrl,
    String contentHash,
    String payloadJson
) {}
