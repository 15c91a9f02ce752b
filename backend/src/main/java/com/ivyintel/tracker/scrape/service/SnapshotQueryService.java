package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.config.ScraperProperties;
import com.ivyintel.tracker.scrape.model.DashboardResponse;
import com.ivyintel.tracker.scrape.model.PageType;
import com.ivyintel.tracker.scrape.model.Snapshot;
import com.ivyintel.tracker.scrape.model.SnapshotFilter;
import com.ivyintel.tracker.scrape.model.SnapshotView;
import com.ivyintel.tracker.scrape.model.UniversityMeta;
import com.ivyintel.tracker.scrape.model.UniversityOverview;
import com.ivyintel.tracker.scrape.persistence.SnapshotPayloads;
import com.ivyintel.tracker.scrape.persistence.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class SnapshotQueryService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotQueryService.class);
    private static final int HISTORY_SCAN_LIMIT = 80;
    private static final int HISTORY_LIMIT = 25;

    private final SnapshotStore store;
    private final SnapshotPayloads payloads;
    private final SourceRegistry sourceRegistry;
    private final ScrapePipelineService pipelineService;
    private final ScraperProperties properties;

    public SnapshotQueryService(
        SnapshotStore store,
        SnapshotPayloads payloads,
        SourceRegistry sourceRegistry,
        ScrapePipelineService pipelineService,
        ScraperProperties properties
    ) {
        this.store = store;
        this.payloads = payloads;
        this.sourceRegistry = sourceRegistry;
        this.pipelineService = pipelineService;
        this.properties = properties;
    }

    public List<SnapshotView> latest(Integer limit) {
        int safeLimit = limit == null ? HISTORY_SCAN_LIMIT : Math.max(1, Math.min(limit, 500));
        return store.listLatest(safeLimit).stream().map(this::toView).toList();
    }

    public UniversityOverview university(String university) {
        List<Snapshot> rows = store.listByUniversity(university);
        Map<String, SnapshotView> latestByType = new LinkedHashMap<>();
        for (PageType type : PageType.values()) {
            latestByType.put(type.key(), null);
        }
        List<SnapshotView> history = new ArrayList<>();
        for (Snapshot row : rows.subList(0, Math.min(HISTORY_SCAN_LIMIT, rows.size()))) {
            SnapshotView view = toView(row);
            if (history.size() < HISTORY_LIMIT) {
                history.add(view);
            }
            if (latestByType.get(row.pageType()) == null) {
                latestByType.put(row.pageType(), view);
            }
        }
        return new UniversityOverview(university, latestByType, history);
    }

    /**
     * Per-university counts and last update. When storage is unreachable the registry view is still returned,
     * with empty meta and a zero record count.
     */
    public DashboardResponse dashboard() {
        List<String> universities = sourceRegistry.universities();
        boolean dbConnected;
        try {
            dbConnected = store.isReachable();
        } catch (DataAccessException e) {
            log.warn("Snapshot storage unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new DashboardResponse(
                false,
                universities,
                sourceRegistry.sources().size(),
                0L,
                new LinkedHashMap<>(),
                pipelineService.lastRun(),
                properties.getSchedule().isEnabled(),
                properties.getSchedule().getIntervalMinutes()
            );
        }

        Map<String, UniversityMeta> meta = new LinkedHashMap<>();
        for (String university : universities) {
            List<Snapshot> latest = store.listByUniversity(university);
            Map<String, Long> counts = new LinkedHashMap<>();
            for (PageType type : PageType.values()) {
                counts.put(type.key(), store.count(new SnapshotFilter(university, type.key())));
            }
            meta.put(university, new UniversityMeta(latest.isEmpty() ? null : latest.get(0).extractedAt(), counts));
        }
        return new DashboardResponse(
            true,
            universities,
            sourceRegistry.sources().size(),
            store.count(SnapshotFilter.all()),
            meta,
            pipelineService.lastRun(),
            properties.getSchedule().isEnabled(),
            properties.getSchedule().getIntervalMinutes()
        );
    }

    private SnapshotView toView(Snapshot snapshot) {
        return new SnapshotView(
            snapshot.university(),
            snapshot.pageType(),
            snapshot.url(),
            snapshot.extractedAt(),
            payloads.decode(snapshot.payloadJson())
        );
    }
}
