package com.ivyintel.tracker.scrape.http;

/**
 * A page could not be retrieved: non-2xx status, network failure or timeout once retries ran out.
 */
public class FetchException extends RuntimeException {
    private final String url;
    private final int statusCode;
    private final String errorCode;

    public FetchException(String url, int statusCode, String errorCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
