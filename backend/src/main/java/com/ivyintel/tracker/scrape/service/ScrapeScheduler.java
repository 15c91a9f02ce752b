package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.config.ScraperProperties;
import com.ivyintel.tracker.scrape.model.PipelineRunReport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Interval trigger for full pipeline runs. Disabled unless {@code scraper.schedule.enabled=true}.
 */
@Service
public class ScrapeScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScrapeScheduler.class);

    private final ScrapePipelineService pipelineService;
    private final ScraperProperties properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService executor;

    public ScrapeScheduler(ScrapePipelineService pipelineService, ScraperProperties properties) {
        this.pipelineService = pipelineService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getSchedule().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return executor != null && !executor.isShutdown();
        }
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (executor != null && !executor.isShutdown()) {
                return;
            }
            ScraperProperties.Schedule schedule = properties.getSchedule();
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "scrape-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            executor.scheduleWithFixedDelay(
                this::runScheduled,
                TimeUnit.SECONDS.toMillis(schedule.getInitialDelaySeconds()),
                TimeUnit.MINUTES.toMillis(schedule.getIntervalMinutes()),
                TimeUnit.MILLISECONDS
            );
            log.info(
                "Scrape scheduler started: every {} minutes, first run in {}s",
                schedule.getIntervalMinutes(),
                schedule.getInitialDelaySeconds()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (executor == null) {
                return;
            }
            executor.shutdownNow();
            executor = null;
            log.info("Scrape scheduler stopped");
        }
    }

    void runScheduled() {
        try {
            PipelineRunReport report = pipelineService.run();
            log.info("Scheduled scrape completed: {}", report);
        } catch (ActivePipelineRunException e) {
            log.info("Scheduled scrape skipped: {}", e.getMessage());
        } catch (Exception e) {
            // An exception escaping here would cancel all future executions.
            log.error("Scheduled scrape failed", e);
        }
    }
}
