package com.ivyintel.tracker.scrape.model;

import java.time.Instant;
import java.util.Map;

public record UniversityMeta(Instant lastUpdated, Map<String, Long> counts) {}
