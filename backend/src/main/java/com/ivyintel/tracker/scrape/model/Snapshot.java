package com.ivyintel.tracker.scrape.model;

import java.time.Instant;

public record Snapshot(
    long id,
    String university,
    String pageType,
    String url,
    Instant extractedAt,
    String contentHash,
    String payloadJson
) {}
