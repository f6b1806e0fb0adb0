package com.stayharvest.crawl.model;

public record DetailHints(
    String link,
    String title,
    String checkin,
    String checkout,
    String categoryTag,
    String photoId,
    String federatedSearchId
) {
    public static DetailHints forLink(String link, String title) {
        return new DetailHints(link, title, null, null, null, null, null);
    }
}
