package com.ivyintel.tracker.scrape.http;

import java.time.Duration;

/**
 * Attempt budget and exponential backoff schedule for a single URL fetch.
 * The wait after attempt {@code n} is {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null || maxBackoff.isNegative() ? Duration.ZERO : maxBackoff;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(8));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public Duration backoffAfter(int attempt) {
        if (initialBackoff.isZero()) {
            return Duration.ZERO;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delayMs = initialBackoff.toMillis() * (1L << shift);
        if (!maxBackoff.isZero()) {
            delayMs = Math.min(delayMs, maxBackoff.toMillis());
        }
        return Duration.ofMillis(delayMs);
    }
}
