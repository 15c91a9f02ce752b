package com.ivyintel.tracker.config;

/**
 * Raised at startup when scraper settings or the source list cannot be used.
 */
public class ScraperConfigurationException extends RuntimeException {
    public ScraperConfigurationException(String message) {
        super(message);
    }

    public ScraperConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
