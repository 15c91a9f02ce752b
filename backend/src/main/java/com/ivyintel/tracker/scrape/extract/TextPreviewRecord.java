package com.ivyintel.tracker.scrape.extract;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TextPreviewRecord(
    @JsonProperty("text_preview") String textPreview,
    @JsonProperty("note") String note
) implements ExtractionRecord {}
