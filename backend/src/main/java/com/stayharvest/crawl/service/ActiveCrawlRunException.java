package com.stayharvest.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;

/**
 * A harvest run was requested while another one is still walking tiles.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveCrawlRunException extends RuntimeException {
    private final Instant runStartedAt;

    public ActiveCrawlRunException(Instant runStartedAt) {
        super(runStartedAt == null
            ? "A harvest run is already walking tiles"
            : "A harvest run started at " + runStartedAt + " is still walking tiles");
        this.runStartedAt = runStartedAt;
    }

    public Instant getRunStartedAt() {
        return runStartedAt;
    }
}
