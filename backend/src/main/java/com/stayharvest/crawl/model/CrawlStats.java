package com.stayharvest.crawl.model;

public record CrawlStats(
    long total,
    long basicOnly,
    long detailed,
    long pendingDetail,
    long tilesProcessed,
    long recentCount
) {
}
