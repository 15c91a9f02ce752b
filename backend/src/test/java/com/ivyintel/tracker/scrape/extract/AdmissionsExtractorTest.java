package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AdmissionsExtractorTest {
    private final AdmissionsExtractor extractor = new AdmissionsExtractor();

    @Test
    void keepsRequirementBulletsInFirstSeenOrder() {
        String html = """
            <h1>Apply</h1>
            <h2>Requirements</h2>
            <h3> </h3>
            <ul>
              <li>Two teacher recommendations are required for all applicants</li>
              <li>Official high school transcript</li>
              <li>Essay</li>
              <li>Two teacher recommendations are required for all applicants</li>
              <li>Visit our campus and meet current students today</li>
            </ul>
            """;

        AdmissionsRecord record = extractor.extract(HtmlText.parse(html));

        assertThat(record.headings()).containsExactly("Apply", "Requirements");
        assertThat(record.requirements()).containsExactly(
            "Two teacher recommendations are required for all applicants",
            "Official high school transcript"
        );
        assertThat(record.note()).isNotBlank();
    }

    @Test
    void capsHeadingsAndRequirements() {
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            html.append("<h2>Section ").append(i).append("</h2>");
            html.append("<li>Requirement number ").append(i).append(" for the essay portion</li>");
        }

        AdmissionsRecord record = extractor.extract(HtmlText.parse(html.toString()));

        assertThat(record.headings()).hasSize(30);
        assertThat(record.requirements()).hasSize(40);
        assertThat(record.requirements().get(0)).isEqualTo("Requirement number 0 for the essay portion");
    }
}
