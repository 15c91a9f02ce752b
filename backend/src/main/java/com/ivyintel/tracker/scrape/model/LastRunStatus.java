package com.ivyintel.tracker.scrape.model;

import java.time.Instant;

public record LastRunStatus(Instant time, PipelineRunReport report) {}
