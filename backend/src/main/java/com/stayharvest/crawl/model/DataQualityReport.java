package com.stayharvest.crawl.model;

public record DataQualityReport(
    long total,
    long withPrice,
    long withPicture,
    long withCoordinates
) {
    public double ratio(long count) {
        return total <= 0 ? 0.0 : (double) count / total;
    }
}
