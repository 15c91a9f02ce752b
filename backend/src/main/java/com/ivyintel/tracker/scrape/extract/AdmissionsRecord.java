package com.ivyintel.tracker.scrape.extract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AdmissionsRecord(
    @JsonProperty("headings") List<String> headings,
    @JsonProperty("requirements") List<String> requirements,
    @JsonProperty("note") String note
) implements ExtractionRecord {}
