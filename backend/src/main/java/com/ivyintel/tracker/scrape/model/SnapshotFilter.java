package com.ivyintel.tracker.scrape.model;

/**
 * Optional equality filters for counting snapshots; a null field matches everything.
 */
public record SnapshotFilter(String university, String pageType) {
    public static SnapshotFilter all() {
        return new SnapshotFilter(null, null);
    }

    public static SnapshotFilter university(String university) {
        return new SnapshotFilter(university, null);
    }
}
