package com.ivyintel.tracker.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActivePipelineRunException extends RuntimeException {
    public ActivePipelineRunException(String message) {
        super(message);
    }
}
