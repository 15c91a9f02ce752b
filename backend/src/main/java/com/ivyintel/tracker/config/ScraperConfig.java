package com.ivyintel.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ivyintel.tracker.scrape.http.RequestRateLimiter;
import com.ivyintel.tracker.scrape.http.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScraperConfig {

    @Bean(name = "scrapeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scrapeExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetchConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getFetchConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public RequestRateLimiter requestRateLimiter(ScraperProperties properties) {
        return new RequestRateLimiter(properties.requestDelay());
    }

    @Bean
    public RetryPolicy retryPolicy(ScraperProperties properties) {
        return new RetryPolicy(
            properties.getRequestMaxAttempts(),
            Duration.ofMillis(properties.getRequestRetryBaseDelayMs()),
            Duration.ofMillis(properties.getRequestRetryMaxDelayMs())
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
