package com.ivyintel.tracker.scrape.extract;

import com.ivyintel.tracker.scrape.util.HtmlText;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProgramsExtractorTest {
    private final ProgramsExtractor extractor = new ProgramsExtractor();

    @Test
    void collectsDisciplineLinksAndListItemsWithoutNavigation() {
        String html = """
            <nav>
              <a href="/apply">Apply Now</a>
              <a href="/login">Login</a>
              <a href="#">Menu</a>
            </nav>
            <a href="/cs">Computer Science</a>
            <a href="/econ">Economics</a>
            <a href="/policy">Privacy and Political Science Policy</a>
            <ul>
              <li>Mechanical Engineering</li>
              <li>Economics</li>
              <li>Go</li>
              <li>African American Studies</li>
            </ul>
            """;

        ProgramsRecord record = extractor.extract(HtmlText.parse(html));

        assertThat(record.programs()).containsExactly(
            "Computer Science",
            "Economics",
            "Mechanical Engineering",
            "African American Studies"
        );
        assertThat(record.countEstimate()).isEqualTo(4);
    }

    @Test
    void capsAtOneHundredTwenty() {
        StringBuilder html = new StringBuilder("<ul>");
        for (int i = 0; i < 200; i++) {
            html.append("<li>Engineering track ").append(i).append("</li>");
        }
        html.append("</ul>");

        ProgramsRecord record = extractor.extract(HtmlText.parse(html.toString()));

        assertThat(record.programs()).hasSize(120);
        assertThat(record.countEstimate()).isEqualTo(120);
    }
}
