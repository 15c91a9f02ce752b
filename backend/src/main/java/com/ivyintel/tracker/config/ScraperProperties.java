package com.ivyintel.tracker.config;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties implements InitializingBean {
    private static final String DEFAULT_USER_AGENT = "IvyIntelTracker/1.0 (+student project; respectful crawler)";

    private String userAgent;
    private int requestTimeoutSeconds = 25;
    private double requestDelaySeconds = 1.0;
    private int maxRecordsPerUniversity = 30;
    private int requestMaxAttempts = 3;
    private int requestRetryBaseDelayMs = 1000;
    private int requestRetryMaxDelayMs = 8000;
    private int fetchConcurrency = 4;
    private String sourcesFile = "classpath:sources.csv";
    private Schedule schedule = new Schedule();
    private Cli cli = new Cli();

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * Rejects settings the pipeline cannot run with. Called once at startup.
     */
    public void validate() {
        if (maxRecordsPerUniversity < 1) {
            throw new ScraperConfigurationException(
                "scraper.max-records-per-university must be at least 1, got " + maxRecordsPerUniversity
            );
        }
        if (requestTimeoutSeconds <= 0) {
            throw new ScraperConfigurationException(
                "scraper.request-timeout-seconds must be positive, got " + requestTimeoutSeconds
            );
        }
        if (requestDelaySeconds < 0 || Double.isNaN(requestDelaySeconds)) {
            throw new ScraperConfigurationException(
                "scraper.request-delay-seconds must not be negative, got " + requestDelaySeconds
            );
        }
        if (requestMaxAttempts < 1) {
            throw new ScraperConfigurationException(
                "scraper.request-max-attempts must be at least 1, got " + requestMaxAttempts
            );
        }
        if (schedule.getIntervalMinutes() < 1) {
            throw new ScraperConfigurationException(
                "scraper.schedule.interval-minutes must be at least 1, got " + schedule.getIntervalMinutes()
            );
        }
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public double getRequestDelaySeconds() {
        return requestDelaySeconds;
    }

    public void setRequestDelaySeconds(double requestDelaySeconds) {
        this.requestDelaySeconds = requestDelaySeconds;
    }

    public Duration requestDelay() {
        return Duration.ofMillis(Math.round(Math.max(0.0, requestDelaySeconds) * 1000.0));
    }

    public int getMaxRecordsPerUniversity() {
        return maxRecordsPerUniversity;
    }

    public void setMaxRecordsPerUniversity(int maxRecordsPerUniversity) {
        this.maxRecordsPerUniversity = maxRecordsPerUniversity;
    }

    public int getRequestMaxAttempts() {
        return requestMaxAttempts;
    }

    public void setRequestMaxAttempts(int requestMaxAttempts) {
        this.requestMaxAttempts = requestMaxAttempts;
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getFetchConcurrency() {
        return Math.max(1, fetchConcurrency);
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = Math.max(1, fetchConcurrency);
    }

    public String getSourcesFile() {
        return sourcesFile;
    }

    public void setSourcesFile(String sourcesFile) {
        this.sourcesFile = sourcesFile;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Schedule {
        private boolean enabled = false;
        private int intervalMinutes = 180;
        private int initialDelaySeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalMinutes() {
            return intervalMinutes;
        }

        public void setIntervalMinutes(int intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
        }

        public int getInitialDelaySeconds() {
            return Math.max(0, initialDelaySeconds);
        }

        public void setInitialDelaySeconds(int initialDelaySeconds) {
            this.initialDelaySeconds = initialDelaySeconds;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String university = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUniversity() {
            return university;
        }

        public void setUniversity(String university) {
            this.university = university;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
