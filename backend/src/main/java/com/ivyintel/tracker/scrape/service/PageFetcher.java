package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.scrape.http.FetchException;
import com.ivyintel.tracker.scrape.http.PoliteHttpClient;
import com.ivyintel.tracker.scrape.model.HttpFetchResult;
import org.springframework.stereotype.Service;

@Service
public class PageFetcher {
    private final PoliteHttpClient httpClient;

    public PageFetcher(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Returns the successful response for {@code url}, or throws once the retry budget is spent.
     */
    public HttpFetchResult fetch(String url) {
        HttpFetchResult result = httpClient.get(url);
        if (result.isSuccessful()) {
            return result;
        }
        String message;
        if (result.errorCode() != null) {
            message = result.errorCode() + (result.errorMessage() == null ? "" : ": " + result.errorMessage());
        } else {
            message = "HTTP " + result.statusCode();
        }
        throw new FetchException(
            url,
            result.statusCode(),
            result.errorCode(),
            "Fetch failed for " + url + " after " + result.attempts() + " attempt(s): " + message
        );
    }
}
