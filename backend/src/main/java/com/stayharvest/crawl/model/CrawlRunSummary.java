package com.stayharvest.crawl.model;

import java.time.Instant;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int tilesProcessed,
    int recordsFound,
    int basicSaved,
    int detailedSaved,
    int cursor,
    String stopReason
) {
}
