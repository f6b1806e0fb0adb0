package com.stayharvest.crawl.model;

public record CrawlStatsResponse(
    CrawlStats stats,
    DataQualityReport dataQuality,
    int cursor,
    boolean runActive
) {
}
