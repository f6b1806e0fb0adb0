package com.stayharvest.crawl.model;

/**
 * Fields of a listing that are available from a search page alone.
 */
public record SearchRecord(
    String id,
    String listingObjType,
    String roomTypeCategory,
    String title,
    String name,
    String picture,
    String checkin,
    String checkout,
    String price,
    String discountedPrice,
    String originalPrice,
    String link,
    String categoryTag,
    String photoId
) {
    public DetailHints toHints(String federatedSearchId) {
        return new DetailHints(link, title, checkin, checkout, categoryTag, photoId, federatedSearchId);
    }
}
