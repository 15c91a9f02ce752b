package com.ivyintel.tracker.scrape.extract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DeadlinesRecord(
    @JsonProperty("highlights") List<String> highlights,
    @JsonProperty("date_lines") List<String> dateLines,
    @JsonProperty("inferred") InferredDeadlines inferred,
    @JsonProperty("note") String note
) implements ExtractionRecord {}
