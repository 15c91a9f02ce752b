package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.config.ScraperConfigurationException;
import com.ivyintel.tracker.config.ScraperProperties;
import com.ivyintel.tracker.scrape.model.PageType;
import com.ivyintel.tracker.scrape.model.Source;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The fixed, ordered list of pages to track, read once from a CSV with columns {@code university,page_type,url}.
 */
@Service
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final List<Source> sources;

    @Autowired
    public SourceRegistry(ScraperProperties properties, ResourceLoader resourceLoader) {
        this(load(resourceLoader.getResource(properties.getSourcesFile())));
    }

    public SourceRegistry(List<Source> sources) {
        this.sources = List.copyOf(sources);
    }

    public static SourceRegistry fromLocation(String location) {
        return new SourceRegistry(load(new DefaultResourceLoader().getResource(location)));
    }

    public List<Source> sources() {
        return sources;
    }

    public List<String> universities() {
        Set<String> names = new LinkedHashSet<>();
        for (Source source : sources) {
            names.add(source.university());
        }
        return names.stream().sorted().toList();
    }

    public List<Source> sourcesForUniversity(String university) {
        if (university == null || university.isBlank()) {
            return List.of();
        }
        String wanted = university.trim().toLowerCase(Locale.ROOT);
        return sources.stream()
            .filter(source -> source.university().toLowerCase(Locale.ROOT).equals(wanted))
            .toList();
    }

    static List<Source> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new ScraperConfigurationException("Sources file not found: " + resource);
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .setCommentMarker('#')
            .build();
        List<Source> out = new ArrayList<>();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                out.add(toSource(record));
            }
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new ScraperConfigurationException("Could not read sources file " + resource, e);
        }
        if (out.isEmpty()) {
            throw new ScraperConfigurationException("Sources file " + resource + " lists no sources");
        }
        log.info("Loaded {} sources from {}", out.size(), resource.getDescription());
        return out;
    }

    private static Source toSource(CSVRecord record) {
        String university = record.get("university");
        String pageTypeKey = record.get("page_type");
        String url = record.get("url");
        if (university.isBlank() || url.isBlank()) {
            throw new ScraperConfigurationException(
                "Sources file line " + record.getRecordNumber() + " is missing university or url"
            );
        }
        PageType pageType = PageType.fromKey(pageTypeKey).orElseThrow(() -> new ScraperConfigurationException(
            "Sources file line " + record.getRecordNumber() + " has unknown page_type '" + pageTypeKey + "'"
        ));
        return new Source(university, pageType, url);
    }
}
