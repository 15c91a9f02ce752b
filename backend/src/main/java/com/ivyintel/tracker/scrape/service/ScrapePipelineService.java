package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.scrape.http.FetchException;
import com.ivyintel.tracker.scrape.model.InsertOutcome;
import com.ivyintel.tracker.scrape.model.LastRunStatus;
import com.ivyintel.tracker.scrape.model.NewSnapshot;
import com.ivyintel.tracker.scrape.model.PipelineRunReport;
import com.ivyintel.tracker.scrape.model.ScrapedPage;
import com.ivyintel.tracker.scrape.model.Source;
import com.ivyintel.tracker.scrape.model.UniversityRunReport;
import com.ivyintel.tracker.scrape.persistence.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs fetch and extract for many sources in parallel, then reconciles each page against storage on the
 * calling thread and trims old snapshots once every insert/skip decision of the batch is final.
 */
@Service
public class ScrapePipelineService {
    private static final Logger log = LoggerFactory.getLogger(ScrapePipelineService.class);

    private final SourceRegistry sourceRegistry;
    private final PageScraper pageScraper;
    private final SnapshotStore store;
    private final SnapshotRetentionService retentionService;
    private final ExecutorService scrapeExecutor;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<LastRunStatus> lastRun = new AtomicReference<>();

    public ScrapePipelineService(
        SourceRegistry sourceRegistry,
        PageScraper pageScraper,
        SnapshotStore store,
        SnapshotRetentionService retentionService,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        Clock clock
    ) {
        this.sourceRegistry = sourceRegistry;
        this.pageScraper = pageScraper;
        this.store = store;
        this.retentionService = retentionService;
        this.scrapeExecutor = scrapeExecutor;
        this.clock = clock;
    }

    public PipelineRunReport run() {
        return run(sourceRegistry.sources());
    }

    public PipelineRunReport run(List<Source> sources) {
        if (!running.compareAndSet(false, true)) {
            throw new ActivePipelineRunException("A scrape run is already in progress");
        }
        try {
            Instant startedAt = clock.instant();
            log.info("Scrape run started for {} sources", sources.size());
            BatchResult batch = scrapeAndPersist(sources);

            if (batch.cancelled()) {
                log.warn("Scrape run cancelled; retention skipped until the next complete run");
            } else {
                Set<String> universities = new LinkedHashSet<>();
                for (Source source : sources) {
                    universities.add(source.university());
                }
                int removed = 0;
                for (String university : universities) {
                    removed += retentionService.trimUniversity(university);
                }
                log.info("Retention pass removed {} snapshot(s) across {} universities", removed, universities.size());
            }

            PipelineRunReport report = new PipelineRunReport(
                batch.saved(),
                batch.skipped(),
                batch.errors(),
                sources.size()
            );
            lastRun.set(new LastRunStatus(clock.instant(), report));
            log.info(
                "Scrape run finished in {}s: saved={} skipped={} errors={} total={}",
                Duration.between(startedAt, clock.instant()).toSeconds(),
                report.savedNewRecords(),
                report.skippedDuplicates(),
                report.errors(),
                report.totalSources()
            );
            return report;
        } finally {
            running.set(false);
        }
    }

    /**
     * Re-scrapes one source on demand. No retention pass.
     */
    public UniversityRunReport runOne(Source source) {
        BatchResult batch = scrapeAndPersist(List.of(source));
        return new UniversityRunReport(source.university(), batch.saved(), batch.errors(), batch.skipped());
    }

    /**
     * Re-scrapes every source of one university (case-insensitive name match). No retention pass.
     */
    public UniversityRunReport runUniversity(String university) {
        List<Source> sources = sourceRegistry.sourcesForUniversity(university);
        if (sources.isEmpty()) {
            return new UniversityRunReport(university, 0, 0, 0);
        }
        BatchResult batch = scrapeAndPersist(sources);
        return new UniversityRunReport(sources.get(0).university(), batch.saved(), batch.errors(), batch.skipped());
    }

    public boolean isRunning() {
        return running.get();
    }

    public LastRunStatus lastRun() {
        return lastRun.get();
    }

    /**
     * Completed pages are persisted even when the run is interrupted; unfinished fetches are cancelled and
     * counted as errors. The interrupt flag is restored after the last write.
     */
    private BatchResult scrapeAndPersist(List<Source> sources) {
        List<Future<ScrapeAttempt>> futures = new ArrayList<>();
        for (Source source : sources) {
            futures.add(scrapeExecutor.submit(() -> attempt(source)));
        }

        int saved = 0;
        int skipped = 0;
        int errors = 0;
        boolean cancelled = false;
        for (int i = 0; i < futures.size(); i++) {
            Source source = sources.get(i);
            Future<ScrapeAttempt> future = futures.get(i);
            ScrapeAttempt attempt;
            if (cancelled) {
                attempt = harvestIfDone(source, future);
            } else {
                try {
                    attempt = future.get();
                } catch (InterruptedException e) {
                    cancelled = true;
                    for (Future<ScrapeAttempt> pending : futures) {
                        if (!pending.isDone()) {
                            pending.cancel(true);
                        }
                    }
                    attempt = harvestIfDone(source, future);
                } catch (ExecutionException e) {
                    log.warn("Scrape failed unexpectedly for {} {} ({})",
                        source.university(), source.pageType().key(), source.url(), e.getCause());
                    attempt = ScrapeAttempt.failed(source, String.valueOf(e.getCause()));
                }
            }

            if (attempt.page() == null) {
                errors++;
                continue;
            }
            if (persist(attempt.page()) == InsertOutcome.INSERTED) {
                saved++;
            } else {
                skipped++;
            }
        }
        if (cancelled) {
            Thread.currentThread().interrupt();
        }
        return new BatchResult(saved, skipped, errors, cancelled);
    }

    private ScrapeAttempt harvestIfDone(Source source, Future<ScrapeAttempt> future) {
        if (!future.isDone() || future.isCancelled()) {
            return ScrapeAttempt.failed(source, "cancelled");
        }
        try {
            return future.get();
        } catch (InterruptedException | ExecutionException | CancellationException e) {
            return ScrapeAttempt.failed(source, "cancelled");
        }
    }

    private ScrapeAttempt attempt(Source source) {
        try {
            return ScrapeAttempt.succeeded(source, pageScraper.scrape(source));
        } catch (FetchException e) {
            log.warn("Fetch failed for {} {}: {}", source.university(), source.pageType().key(), e.getMessage());
            return ScrapeAttempt.failed(source, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Scrape failed for {} {} ({})", source.university(), source.pageType().key(), source.url(), e);
            return ScrapeAttempt.failed(source, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private InsertOutcome persist(ScrapedPage page) {
        Source source = page.source();
        InsertOutcome outcome = store.insert(new NewSnapshot(
            source.university(),
            source.pageType().key(),
            source.url(),
            clock.instant(),
            page.contentHash(),
            page.payloadJson()
        ));
        if (outcome == InsertOutcome.INSERTED) {
            log.info("Saved new snapshot for {} {} (hash {})",
                source.university(), source.pageType().key(), abbreviate(page.contentHash()));
            if (!page.finalUrl().equals(source.url())) {
                log.debug("{} redirected to {}", source.url(), page.finalUrl());
            }
        } else {
            log.debug("Unchanged content for {} {}", source.university(), source.pageType().key());
        }
        return outcome;
    }

    private static String abbreviate(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }

    private record ScrapeAttempt(Source source, ScrapedPage page, String error) {
        static ScrapeAttempt succeeded(Source source, ScrapedPage page) {
            return new ScrapeAttempt(source, page, null);
        }

        static ScrapeAttempt failed(Source source, String error) {
            return new ScrapeAttempt(source, null, error);
        }
    }

    private record BatchResult(int saved, int skipped, int errors, boolean cancelled) {}
}
