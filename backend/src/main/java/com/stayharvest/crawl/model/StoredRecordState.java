package com.stayharvest.crawl.model;

import java.time.Instant;

public record StoredRecordState(
    String id,
    Instant lastScrapedAt,
    boolean detailComplete
) {
}
