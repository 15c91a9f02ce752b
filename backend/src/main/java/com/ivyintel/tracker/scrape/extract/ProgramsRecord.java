package com.ivyintel.tracker.scrape.extract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProgramsRecord(
    @JsonProperty("programs") List<String> programs,
    @JsonProperty("count_estimate") int countEstimate,
    @JsonProperty("note") String note
) implements ExtractionRecord {}
