package com.ivyintel.tracker.scrape.extract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FeesRecord(
    @JsonProperty("summary") FeeSummary summary,
    @JsonProperty("estimated_total_maybe") String estimatedTotalMaybe,
    @JsonProperty("tables") List<List<List<String>>> tables,
    @JsonProperty("note") String note
) implements ExtractionRecord {}
