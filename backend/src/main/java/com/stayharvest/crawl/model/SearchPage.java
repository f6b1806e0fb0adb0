package com.stayharvest.crawl.model;

import java.util.List;

public record SearchPage(
    List<SearchRecord> records,
    String nextCursor,
    int totalPages,
    String federatedSearchId,
    int candidateCount,
    boolean deepScanUsed
) {
    public static SearchPage empty() {
        return new SearchPage(List.of(), null, 0, null, 0, false);
    }
}
