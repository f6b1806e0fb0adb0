package com.stayharvest.crawl.geo;

/**
 * Web-mercator zoom level that fits a bounding box into a viewport of the given pixel size.
 */
public final class GeoTileMath {
    public static final int GLOBE_WIDTH = 256;
    public static final int ZOOM_MIN = 1;
    public static final int ZOOM_MAX = 21;

    private GeoTileMath() {
    }

    public static int zoomLevel(double swLat, double swLng, double neLat, double neLng, int widthPx, int heightPx) {
        int width = widthZoom(swLng, neLng, widthPx);
        int height = heightZoom(swLat, neLat, heightPx);
        return clamp(Math.min(width, height));
    }

    static int widthZoom(double swLng, double neLng, int widthPx) {
        double angle = neLng - swLng;
        if (angle < 0) {
            angle += 360;
        }
        if (angle <= 0) {
            return ZOOM_MAX;
        }
        return floorLog2(widthPx * 360.0 / angle / GLOBE_WIDTH);
    }

    static int heightZoom(double swLat, double neLat, int heightPx) {
        double fraction = Math.log(
            Math.tan(Math.toRadians(neLat) / 2 + Math.PI / 4) / Math.tan(Math.toRadians(swLat) / 2 + Math.PI / 4)
        );
        if (!(fraction > 0)) {
            return ZOOM_MAX;
        }
        return floorLog2(heightPx * 2.0 / fraction / GLOBE_WIDTH);
    }

    private static int floorLog2(double value) {
        if (!(value > 0)) {
            return ZOOM_MIN;
        }
        if (Double.isInfinite(value)) {
            return ZOOM_MAX;
        }
        double zoom = Math.floor(Math.log(value) / Math.log(2));
        if (zoom >= ZOOM_MAX) {
            return ZOOM_MAX;
        }
        return zoom <= ZOOM_MIN ? ZOOM_MIN : (int) zoom;
    }

    private static int clamp(int zoom) {
        return Math.max(ZOOM_MIN, Math.min(ZOOM_MAX, zoom));
    }
}
