package com.ivyintel.tracker.scrape.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PipelineRunReport(
    @JsonProperty("saved_new_records") int savedNewRecords,
    @JsonProperty("skipped_duplicates") int skippedDuplicates,
    @JsonProperty("errors") int errors,
    @JsonProperty("total_sources") int totalSources
) {}
