package com.ivyintel.tracker.scrape.api;

import com.ivyintel.tracker.scrape.model.DashboardResponse;
import com.ivyintel.tracker.scrape.model.PipelineRunReport;
import com.ivyintel.tracker.scrape.model.SnapshotView;
import com.ivyintel.tracker.scrape.model.UniversityOverview;
import com.ivyintel.tracker.scrape.model.UniversityRunReport;
import com.ivyintel.tracker.scrape.service.ScrapePipelineService;
import com.ivyintel.tracker.scrape.service.SnapshotQueryService;
import com.ivyintel.tracker.scrape.service.SourceRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private final ScrapePipelineService pipelineService;
    private final SnapshotQueryService queryService;
    private final SourceRegistry sourceRegistry;

    public ScrapeController(
        ScrapePipelineService pipelineService,
        SnapshotQueryService queryService,
        SourceRegistry sourceRegistry
    ) {
        this.pipelineService = pipelineService;
        this.queryService = queryService;
        this.sourceRegistry = sourceRegistry;
    }

    @GetMapping("/ping")
    public Map<String, Boolean> ping() {
        return Map.of("ok", true);
    }

    @PostMapping("/scrape/run")
    public PipelineRunReport runScrape() {
        return pipelineService.run();
    }

    @PostMapping("/scrape/universities/{name}")
    public UniversityRunReport runUniversity(@PathVariable("name") String name) {
        requireKnownUniversity(name);
        return pipelineService.runUniversity(name);
    }

    @GetMapping("/snapshots/latest")
    public List<SnapshotView> latest(@RequestParam(name = "limit", required = false) Integer limit) {
        return queryService.latest(limit);
    }

    @GetMapping("/universities/{name}")
    public UniversityOverview university(@PathVariable("name") String name) {
        String canonical = requireKnownUniversity(name);
        return queryService.university(canonical);
    }

    @GetMapping("/dashboard")
    public DashboardResponse dashboard() {
        return queryService.dashboard();
    }

    private String requireKnownUniversity(String name) {
        return sourceRegistry.sourcesForUniversity(name).stream()
            .findFirst()
            .map(source -> source.university())
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown university: " + name));
    }
}
