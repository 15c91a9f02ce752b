package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.config.ScraperProperties;
import com.ivyintel.tracker.scrape.model.PipelineRunReport;
import com.ivyintel.tracker.scrape.model.UniversityRunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapePipelineService pipelineService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapePipelineService pipelineService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String university = properties.getCli().getUniversity();
        if (university != null && !university.isBlank()) {
            UniversityRunReport report = pipelineService.runUniversity(university.trim());
            log.info(
                "CLI scrape for {}: saved={}, skipped={}, errors={}",
                report.university(),
                report.savedNewRecords(),
                report.skippedDuplicates(),
                report.errors()
            );
        } else {
            PipelineRunReport report = pipelineService.run();
            log.info(
                "CLI scrape: saved={}, skipped={}, errors={}, total={}",
                report.savedNewRecords(),
                report.skippedDuplicates(),
                report.errors(),
                report.totalSources()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
