package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.config.ScraperProperties;
import com.ivyintel.tracker.scrape.model.Snapshot;
import com.ivyintel.tracker.scrape.persistence.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Keeps only the most recently extracted snapshots of each university, across all of its page types.
 */
@Service
public class SnapshotRetentionService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotRetentionService.class);

    private final SnapshotStore store;
    private final ScraperProperties properties;

    public SnapshotRetentionService(SnapshotStore store, ScraperProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    /**
     * Deletes every snapshot of {@code university} beyond the configured cap, oldest first.
     *
     * @return number of snapshots deleted
     */
    @Transactional
    public int trimUniversity(String university) {
        int keep = properties.getMaxRecordsPerUniversity();
        List<Snapshot> snapshots = store.listByUniversity(university);
        if (snapshots.size() <= keep) {
            return 0;
        }
        List<Snapshot> expired = snapshots.subList(keep, snapshots.size());
        for (Snapshot snapshot : expired) {
            store.delete(snapshot.id());
        }
        log.info("Retention removed {} snapshot(s) for {} (kept {})", expired.size(), university, keep);
        return expired.size();
    }
}
