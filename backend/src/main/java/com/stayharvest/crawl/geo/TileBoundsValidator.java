package com.stayharvest.crawl.geo;

import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.Tile;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rejects tiles that are inverted, too large, or outside the configured region.
 */
@Component
public class TileBoundsValidator {
    private final HarvesterProperties properties;

    public TileBoundsValidator(HarvesterProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the reason the tile is implausible, or empty when it can be crawled
     */
    public Optional<String> rejectionReason(Tile tile) {
        if (!isFinite(tile.swLat()) || !isFinite(tile.swLng()) || !isFinite(tile.neLat()) || !isFinite(tile.neLng())) {
            return Optional.of("non-finite coordinate");
        }
        HarvesterProperties.Region region = properties.getRegion();
        if (!within(tile.swLat(), region.getMinLat(), region.getMaxLat())
            || !within(tile.neLat(), region.getMinLat(), region.getMaxLat())) {
            return Optional.of("latitude outside region");
        }
        if (!within(tile.swLng(), region.getMinLng(), region.getMaxLng())
            || !within(tile.neLng(), region.getMinLng(), region.getMaxLng())) {
            return Optional.of("longitude outside region");
        }
        if (tile.swLat() >= tile.neLat() || tile.swLng() >= tile.neLng()) {
            return Optional.of("inverted corners");
        }
        double maxSpan = properties.getMaxTileSpanDegrees();
        if (tile.latSpan() > maxSpan || tile.lngSpan() > maxSpan) {
            return Optional.of("span exceeds " + maxSpan + " degrees");
        }
        return Optional.empty();
    }

    private static boolean within(double value, double min, double max) {
        return value >= min && value <= max;
    }

    private static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }
}
