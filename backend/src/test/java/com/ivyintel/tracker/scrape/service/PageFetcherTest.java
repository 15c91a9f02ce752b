package com.ivyintel.tracker.scrape.service;

import com.ivyintel.tracker.scrape.http.FetchException;
import com.ivyintel.tracker.scrape.http.PoliteHttpClient;
import com.ivyintel.tracker.scrape.model.HttpFetchResult;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PageFetcherTest {
    private static final String URL = "https://www.columbia.edu/admissions";

    private final PoliteHttpClient httpClient = mock(PoliteHttpClient.class);
    private final PageFetcher fetcher = new PageFetcher(httpClient);

    @Test
    void returnsSuccessfulResponses() {
        HttpFetchResult ok = result(200, "<p>hi</p>", null);
        when(httpClient.get(URL)).thenReturn(ok);

        assertThat(fetcher.fetch(URL)).isSameAs(ok);
    }

    @Test
    void nonSuccessStatusBecomesFetchException() {
        when(httpClient.get(URL)).thenReturn(result(404, "missing", null));

        assertThatThrownBy(() -> fetcher.fetch(URL))
            .isInstanceOfSatisfying(FetchException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(404);
                assertThat(e.getUrl()).isEqualTo(URL);
                assertThat(e.getMessage()).contains("HTTP 404").contains("1 attempt(s)");
            });
    }

    @Test
    void networkFailureKeepsItsErrorCode() {
        when(httpClient.get(URL)).thenReturn(result(0, null, "timeout").withAttempts(3));

        assertThatThrownBy(() -> fetcher.fetch(URL))
            .isInstanceOfSatisfying(FetchException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo("timeout");
                assertThat(e.getMessage()).contains("after 3 attempt(s)").contains("timeout");
            });
    }

    private static HttpFetchResult result(int status, String body, String errorCode) {
        return new HttpFetchResult(
            URL,
            errorCode == null ? URI.create(URL) : null,
            status,
            body,
            "text/html",
            1,
            Instant.now(),
            Duration.ofMillis(5),
            errorCode,
            errorCode == null ? null : "request timed out"
        );
    }
}
