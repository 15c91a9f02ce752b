package com.ivyintel.tracker.scrape.api;

import com.ivyintel.tracker.scrape.service.ActivePipelineRunException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ScrapeExceptionHandler {

    @ExceptionHandler(ActivePipelineRunException.class)
    public ResponseEntity<Map<String, String>> handleActiveRun(ActivePipelineRunException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "active_scrape_run", "message", ex.getMessage()));
    }
}
