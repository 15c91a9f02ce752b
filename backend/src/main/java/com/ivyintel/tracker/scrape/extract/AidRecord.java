package com.ivyintel.tracker.scrape.extract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AidRecord(
    @JsonProperty("summary") List<String> summary,
    @JsonProperty("note") String note
) implements ExtractionRecord {}
