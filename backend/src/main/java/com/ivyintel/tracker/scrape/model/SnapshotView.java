package com.ivyintel.tracker.scrape.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record SnapshotView(
    String university,
    String pageType,
    String url,
    Instant extractedAt,
    JsonNode data
) {}
