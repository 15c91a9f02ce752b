package com.ivyintel.tracker.scrape.model;

import java.util.List;
import java.util.Map;

/**
 * Latest snapshot per page type (null where none exists yet) plus recent history, newest first.
 */
public record UniversityOverview(
    String university,
    Map<String, SnapshotView> latestByType,
    List<SnapshotView> history
) {}
