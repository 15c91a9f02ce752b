package com.ivyintel.tracker.scrape.api;

import com.ivyintel.tracker.scrape.model.PageType;
import com.ivyintel.tracker.scrape.model.PipelineRunReport;
import com.ivyintel.tracker.scrape.model.Source;
import com.ivyintel.tracker.scrape.model.UniversityRunReport;
import com.ivyintel.tracker.scrape.service.ActivePipelineRunException;
import com.ivyintel.tracker.scrape.service.ScrapePipelineService;
import com.ivyintel.tracker.scrape.service.SnapshotQueryService;
import com.ivyintel.tracker.scrape.service.SourceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ScrapeControllerTest {
    private final ScrapePipelineService pipelineService = mock(ScrapePipelineService.class);
    private final SnapshotQueryService queryService = mock(SnapshotQueryService.class);
    private final SourceRegistry sourceRegistry = new SourceRegistry(List.of(
        new Source("Harvard", PageType.FEES, "https://college.harvard.edu/fees")
    ));

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new ScrapeController(pipelineService, queryService, sourceRegistry))
            .setControllerAdvice(new ScrapeExceptionHandler())
            .build();
    }

    @Test
    void overlappingRunIsAConflict() throws Exception {
        when(pipelineService.run()).thenThrow(new ActivePipelineRunException("A scrape run is already in progress"));

        mockMvc.perform(post("/api/scrape/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("active_scrape_run"))
            .andExpect(jsonPath("$.message").value("A scrape run is already in progress"));
    }

    @Test
    void runReportUsesSnakeCaseFields() throws Exception {
        when(pipelineService.run()).thenReturn(new PipelineRunReport(4, 28, 1, 33));

        mockMvc.perform(post("/api/scrape/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.saved_new_records").value(4))
            .andExpect(jsonPath("$.skipped_duplicates").value(28))
            .andExpect(jsonPath("$.errors").value(1))
            .andExpect(jsonPath("$.total_sources").value(33));
    }

    @Test
    void universityRunResolvesTheCanonicalName() throws Exception {
        when(pipelineService.runUniversity("HARVARD")).thenReturn(new UniversityRunReport("Harvard", 1, 0, 0));

        mockMvc.perform(post("/api/scrape/universities/{name}", "HARVARD"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.university").value("Harvard"))
            .andExpect(jsonPath("$.saved_new_records").value(1));
    }
}
