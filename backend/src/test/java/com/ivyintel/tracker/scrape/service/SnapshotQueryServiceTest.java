package com.ivyintel.tracker.scrape.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivyintel.tracker.config.ScraperProperties;
import com.ivyintel.tracker.scrape.model.DashboardResponse;
import com.ivyintel.tracker.scrape.model.NewSnapshot;
import com.ivyintel.tracker.scrape.model.PageType;
import com.ivyintel.tracker.scrape.model.Source;
import com.ivyintel.tracker.scrape.persistence.InMemorySnapshotStore;
import com.ivyintel.tracker.scrape.persistence.SnapshotPayloads;
import com.ivyintel.tracker.scrape.persistence.SnapshotStore;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SnapshotQueryServiceTest {
    private final SourceRegistry registry = new SourceRegistry(List.of(
        new Source("Cornell", PageType.FEES, "https://www.cornell.edu/fees"),
        new Source("Brown", PageType.ABOUT, "https://www.brown.edu/about")
    ));
    private final ScrapePipelineService pipelineService = mock(ScrapePipelineService.class);

    @Test
    void dashboardCountsSnapshotsPerUniversityAndPageType() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        Instant extractedAt = Instant.parse("2025-05-01T10:00:00Z");
        store.insert(new NewSnapshot("Cornell", "fees", "https://www.cornell.edu/fees", extractedAt, "a", "{}"));

        DashboardResponse dashboard = service(store).dashboard();

        assertThat(dashboard.dbConnectivity()).isTrue();
        assertThat(dashboard.universities()).containsExactly("Brown", "Cornell");
        assertThat(dashboard.recordCount()).isEqualTo(1L);
        assertThat(dashboard.meta().get("Cornell").lastUpdated()).isEqualTo(extractedAt);
        assertThat(dashboard.meta().get("Cornell").counts()).containsEntry("fees", 1L).containsEntry("aid", 0L);
        assertThat(dashboard.meta().get("Brown").lastUpdated()).isNull();
    }

    @Test
    void unreachableStorageStillReturnsTheSourceView() {
        SnapshotStore store = mock(SnapshotStore.class);
        when(store.isReachable()).thenThrow(new CannotGetJdbcConnectionException("connection refused"));

        DashboardResponse dashboard = service(store).dashboard();

        assertThat(dashboard.dbConnectivity()).isFalse();
        assertThat(dashboard.universities()).containsExactly("Brown", "Cornell");
        assertThat(dashboard.sourceCount()).isEqualTo(2);
        assertThat(dashboard.recordCount()).isZero();
        assertThat(dashboard.meta()).isEmpty();
    }

    private SnapshotQueryService service(SnapshotStore store) {
        return new SnapshotQueryService(
            store,
            new SnapshotPayloads(new ObjectMapper()),
            registry,
            pipelineService,
            new ScraperProperties()
        );
    }
}
