package com.stayharvest.crawl.extract;

import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.DetailRecord;
import com.stayharvest.crawl.model.SearchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plausibility checks on extracted listings. Only an unusable id makes a record invalid; everything
 * else is reported as a warning and the record is kept.
 */
@Component
public class ListingValidator {
    private static final Logger log = LoggerFactory.getLogger(ListingValidator.class);

    static final double MIN_PLAUSIBLE_PRICE = 50;
    static final double MAX_PLAUSIBLE_PRICE = 50_000;
    static final int MAX_GUEST_CAPACITY = 50;
    static final double MAX_RATING = 5.0;
    static final int MAX_ID_LENGTH = 64;
    private static final Pattern PICTURE_URL = Pattern.compile("^https://a\\d\\.muscache\\.com/im/.*");

    private final HarvesterProperties properties;
    private final Pattern pricePattern;

    public ListingValidator(HarvesterProperties properties) {
        this.properties = properties;
        String currency = properties.getProvider().getCurrencyCode();
        String prefix = currency == null || currency.isBlank() ? "" : Pattern.quote(currency.trim().toUpperCase(Locale.ROOT));
        this.pricePattern = Pattern.compile(prefix + "\\s*([0-9][0-9,]*)");
    }

    public record ValidationResult(boolean valid, List<String> warnings, List<String> errors) {
        public ValidationResult {
            warnings = List.copyOf(warnings);
            errors = List.copyOf(errors);
        }
    }

    public ValidationResult validate(SearchRecord record) {
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        if (record == null || !IdentifierNormalizer.isAllDigits(record.id())) {
            errors.add("Invalid id: " + (record == null ? null : record.id()));
            log.warn("Validation errors for listing: {}", errors);
            return new ValidationResult(false, warnings, errors);
        }
        if (record.id().length() > MAX_ID_LENGTH) {
            errors.add("Id longer than " + MAX_ID_LENGTH + " digits: " + abbreviate(record.id()));
            log.warn("Validation errors for listing: {}", errors);
            return new ValidationResult(false, warnings, errors);
        }
        if (record.price() != null) {
            Double amount = parsePrice(record.price());
            if (amount == null) {
                warnings.add("Price format issue: " + record.price());
            } else if (amount < MIN_PLAUSIBLE_PRICE || amount > MAX_PLAUSIBLE_PRICE) {
                warnings.add("Price out of expected range: " + record.price());
            }
        }
        if (record.picture() != null && !PICTURE_URL.matcher(record.picture()).matches()) {
            warnings.add("Unexpected picture URL: " + abbreviate(record.picture()));
        }
        if (!warnings.isEmpty()) {
            log.warn("Validation warnings for listing {}: {}", record.id(), warnings);
        }
        return new ValidationResult(true, warnings, errors);
    }

    public ValidationResult validate(String id, DetailRecord detail) {
        List<String> warnings = new ArrayList<>();
        if (detail.host() == null) {
            warnings.add("No host information");
        }
        if (detail.lat() != null && detail.lng() != null && !insideRegion(detail.lat(), detail.lng())) {
            warnings.add("Coordinates outside region: " + detail.lat() + ", " + detail.lng());
        }
        if (detail.averageRating() < 0 || detail.averageRating() > MAX_RATING) {
            warnings.add("Invalid average rating: " + detail.averageRating());
        }
        if (detail.hostRatingAverage() < 0 || detail.hostRatingAverage() > MAX_RATING) {
            warnings.add("Invalid host rating: " + detail.hostRatingAverage());
        }
        if (detail.maxGuestCapacity() != 0 && (detail.maxGuestCapacity() < 1 || detail.maxGuestCapacity() > MAX_GUEST_CAPACITY)) {
            warnings.add("Unusual guest capacity: " + detail.maxGuestCapacity());
        }
        if (!warnings.isEmpty()) {
            log.debug("Detail validation warnings for listing {}: {}", id, warnings);
        }
        return new ValidationResult(true, warnings, List.of());
    }

    Double parsePrice(String price) {
        Matcher matcher = pricePattern.matcher(price.toUpperCase(Locale.ROOT));
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group(1).replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean insideRegion(double lat, double lng) {
        HarvesterProperties.Region region = properties.getRegion();
        return lat >= region.getMinLat() && lat <= region.getMaxLat()
            && lng >= region.getMinLng() && lng <= region.getMaxLng();
    }

    private static String abbreviate(String value) {
        return value.length() <= 50 ? value : value.substring(0, 50) + "...";
    }
}
