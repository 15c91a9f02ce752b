package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.scrape.extract.ExtractionRecord;
import com.ivyintel.tracker.scrape.extract.ExtractorSuite;
import com.ivyintel.tracker.scrape.model.HttpFetchResult;
import com.ivyintel.tracker.scrape.model.ScrapedPage;
import com.ivyintel.tracker.scrape.model.Source;
import com.ivyintel.tracker.scrape.persistence.SnapshotPayloads;
import com.ivyintel.tracker.scrape.util.ContentFingerprinter;
import org.springframework.stereotype.Service;

/**
 * Fetch, fingerprint and extract a single source. Touches no storage.
 */
@Service
public class PageScraper {
    private final PageFetcher pageFetcher;
    private final ExtractorSuite extractorSuite;
    private final SnapshotPayloads payloads;

    public PageScraper(PageFetcher pageFetcher, ExtractorSuite extractorSuite, SnapshotPayloads payloads) {
        this.pageFetcher = pageFetcher;
        this.extractorSuite = extractorSuite;
        this.payloads = payloads;
    }

    public ScrapedPage scrape(Source source) {
        HttpFetchResult fetched = pageFetcher.fetch(source.url());
        String html = fetched.body() == null ? "" : fetched.body();
        String contentHash = ContentFingerprinter.fingerprint(html);
        ExtractionRecord record = extractorSuite.extract(source.pageType(), html);
        return new ScrapedPage(source, fetched.finalUrlOrRequested(), contentHash, payloads.encode(record));
    }
}
