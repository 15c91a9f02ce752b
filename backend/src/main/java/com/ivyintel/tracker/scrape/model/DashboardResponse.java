package com.ivyintel.tracker.scrape.model;

import java.util.List;
import java.util.Map;

public record DashboardResponse(
    boolean dbConnectivity,
    List<String> universities,
    int sourceCount,
    long recordCount,
    Map<String, UniversityMeta> meta,
    LastRunStatus lastRun,
    boolean scheduleEnabled,
    int scheduleMinutes
) {}
