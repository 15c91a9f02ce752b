package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlinesExtractorTest {
    private final DeadlinesExtractor extractor = new DeadlinesExtractor();

    @Test
    void separatesDeadlineHighlightsFromPlainDateLines() {
        String html = """
            <div>
              <h2>Dates and Deadlines</h2>
              <p>Early Decision deadline: <strong>November 1</strong></p>
              <p>Regular Decision deadline: January 2</p>
              <p>Financial aid forms due Feb 15</p>
              <p>Campus tours resume March 3 for visitors</p>
              <p>Applicants are reviewed holistically by our committee.</p>
              <p>Early Decision deadline: November 1</p>
            </div>
            """;

        DeadlinesRecord record = extractor.extract(HtmlText.parse(html));

        assertThat(record.highlights()).containsExactly(
            "Early Decision deadline: November 1",
            "Regular Decision deadline: January 2",
            "Financial aid forms due Feb 15"
        );
        assertThat(record.dateLines()).containsExactly(
            "Early Decision deadline: November 1",
            "Regular Decision deadline: January 2",
            "Financial aid forms due Feb 15",
            "Campus tours resume March 3 for visitors"
        );
        assertThat(record.inferred().early()).isEqualTo(DeadlinesExtractor.EARLY_HINT);
        assertThat(record.inferred().regular()).isEqualTo(DeadlinesExtractor.REGULAR_HINT);
    }

    @Test
    void pageWithoutDatesYieldsEmptyListsAndNoHints() {
        DeadlinesRecord record = extractor.extract(HtmlText.parse("<p>Welcome to the admissions office</p>"));

        assertThat(record.highlights()).isEmpty();
        assertThat(record.dateLines()).isEmpty();
        assertThat(record.inferred().early()).isNull();
        assertThat(record.inferred().regular()).isNull();
    }

    @Test
    void capsBothListsAtTwentyFive() {
        StringBuilder html = new StringBuilder();
        for (int day = 1; day <= 30; day++) {
            html.append("<p>Deadline for cohort ").append(day).append(": October ").append(day).append("</p>");
        }

        DeadlinesRecord record = extractor.extract(HtmlText.parse(html.toString()));

        assertThat(record.highlights()).hasSize(25);
        assertThat(record.dateLines()).hasSize(25);
    }
}
