package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.config.ScraperConfigurationException;
import com.ivyintel.tracker.scrape.model.PageType;
import com.ivyintel.tracker.scrape.model.Source;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryTest {

    @Test
    void loadsSourcesInFileOrderAndSkipsComments() {
        SourceRegistry registry = SourceRegistry.fromLocation("classpath:sources-test.csv");

        assertThat(registry.sources()).containsExactly(
            new Source("Test University", PageType.FEES, "http://127.0.0.1:9/fees"),
            new Source("Test University", PageType.ABOUT, "http://127.0.0.1:9/about"),
            new Source("Other College", PageType.DEADLINES, "http://127.0.0.1:9/deadlines")
        );
        assertThat(registry.universities()).containsExactly("Other College", "Test University");
    }

    @Test
    void universityLookupIgnoresCaseAndSurroundingWhitespace() {
        SourceRegistry registry = SourceRegistry.fromLocation("classpath:sources-test.csv");

        assertThat(registry.sourcesForUniversity("  test UNIVERSITY ")).hasSize(2);
        assertThat(registry.sourcesForUniversity("Unknown")).isEmpty();
        assertThat(registry.sourcesForUniversity(null)).isEmpty();
    }

    @Test
    void bundledSourceListCoversTheEightIvies() {
        SourceRegistry registry = SourceRegistry.fromLocation("classpath:sources.csv");

        assertThat(registry.universities()).containsExactly(
            "Brown", "Columbia", "Cornell", "Dartmouth", "Harvard", "Penn", "Princeton", "Yale"
        );
        assertThat(registry.sources()).hasSize(33);
    }

    @Test
    void unknownPageTypeIsAConfigurationError() {
        assertThatThrownBy(() -> SourceRegistry.fromLocation("classpath:sources-bad-page-type.csv"))
            .isInstanceOf(ScraperConfigurationException.class)
            .hasMessageContaining("unknown page_type 'tuition'");
    }

    @Test
    void missingFileIsAConfigurationError() {
        assertThatThrownBy(() -> SourceRegistry.fromLocation("classpath:does-not-exist.csv"))
            .isInstanceOf(ScraperConfigurationException.class)
            .hasMessageContaining("not found");
    }
}
