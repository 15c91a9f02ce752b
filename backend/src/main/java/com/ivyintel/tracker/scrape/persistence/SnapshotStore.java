package com.ivyintel.tracker.scrape.persistence;

import com.ivyintel.tracker.scrape.model.InsertOutcome;
import com.ivyintel.tracker.scrape.model.NewSnapshot;
import com.ivyintel.tracker.scrape.model.Snapshot;
import com.ivyintel.tracker.scrape.model.SnapshotFilter;

import java.util.List;

/**
 * Append-only snapshot storage. {@code (url, contentHash)} is unique across all rows.
 */
public interface SnapshotStore {

    /**
     * Stores the snapshot unless one with the same url and content hash already exists.
     */
    InsertOutcome insert(NewSnapshot snapshot);

    /**
     * All snapshots of a university, newest extraction first.
     */
    List<Snapshot> listByUniversity(String university);

    List<Snapshot> listLatest(int limit);

    void delete(long snapshotId);

    long count(SnapshotFilter filter);

    boolean isReachable();
}
