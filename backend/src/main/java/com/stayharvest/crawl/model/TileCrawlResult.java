package com.stayharvest.crawl.model;

public record TileCrawlResult(
    int tileOrdinal,
    boolean fetched,
    boolean interrupted,
    int pagesFetched,
    int recordsFound,
    int basicSaved,
    int detailedSaved
) {
    public static TileCrawlResult abandoned(int tileOrdinal) {
        return new TileCrawlResult(tileOrdinal, false, false, 0, 0, 0, 0);
    }
}
