package com.stayharvest.crawl.model;

/**
 * Fields that only the per-listing detail document carries. Absent sections keep the zero values of {@link #empty()}.
 */
public record DetailRecord(
    int reviewsCount,
    double averageRating,
    String host,
    boolean luxe,
    String location,
    int maxGuestCapacity,
    boolean guestFavorite,
    Double lat,
    Double lng,
    boolean superhost,
    boolean verified,
    int hostRatingCount,
    String hostUserId,
    int hostYears,
    int hostMonths,
    double hostRatingAverage
) {
    public static DetailRecord empty() {
        return new DetailRecord(0, 0.0, null, false, null, 0, false, null, null, false, false, 0, null, 0, 0, 0.0);
    }
}
