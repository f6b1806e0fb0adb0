package com.stayharvest.crawl.model;

public record PendingDetail(
    String id,
    String link,
    String title
) {
}
