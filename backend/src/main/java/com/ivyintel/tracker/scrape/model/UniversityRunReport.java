package com.ivyintel.tracker.scrape.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UniversityRunReport(
    @JsonProperty("university") String university,
    @JsonProperty("saved_new_records") int savedNewRecords,
    @JsonProperty("errors") int errors,
    @JsonProperty("skipped_duplicates") int skippedDuplicates
) {}
