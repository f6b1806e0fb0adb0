package com.stayharvest.crawl.model;

public record Tile(
    int ordinal,
    double swLat,
    double swLng,
    double neLat,
    double neLng
) {
    public double latSpan() {
        return neLat - swLat;
    }

    public double lngSpan() {
        return neLng - swLng;
    }

    public String describe() {
        return "SW(" + swLat + ", " + swLng + ") NE(" + neLat + ", " + neLng + ")";
    }
}
