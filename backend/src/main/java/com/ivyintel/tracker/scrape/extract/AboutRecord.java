package com.ivyintel.tracker.scrape.extract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AboutRecord(
    @JsonProperty("overview") List<String> overview,
    @JsonProperty("note") String note
) implements ExtractionRecord {}
