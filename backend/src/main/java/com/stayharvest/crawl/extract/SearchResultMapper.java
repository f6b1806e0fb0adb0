package com.stayharvest.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.stayharvest.crawl.model.SearchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one search-result candidate node into a {@link SearchRecord}, trying the field aliases the
 * provider has used over time.
 */
public class SearchResultMapper {
    private static final Logger log = LoggerFactory.getLogger(SearchResultMapper.class);

    static final String DEFAULT_OBJECT_TYPE = "REGULAR";
    static final String DEFAULT_ROOM_TYPE = "unavailable";

    private static final List<String> PICTURE_LISTS = List.of(
        "contextualPictures",
        "listingContextualPictures",
        "pictures",
        "images",
        "photos",
        "media",
        "cardPhotos"
    );
    private static final List<String> PICTURE_LIST_FIELDS = List.of("picture", "url", "src", "uri");
    private static final List<String> PICTURE_SINGLES = List.of("previewImage", "mainImage", "heroImage", "thumbnail", "image");

    private final String listingBaseUrl;

    public SearchResultMapper(String listingBaseUrl) {
        this.listingBaseUrl = listingBaseUrl;
    }

    public Optional<SearchRecord> map(JsonNode item) {
        if (item == null || !item.isObject()) {
            return Optional.empty();
        }
        JsonNode listing = resolveListing(item);
        if (listing == null) {
            log.debug("Skipping candidate without a listing node, fields={}", fieldNames(item));
            return Optional.empty();
        }
        JsonNode rawId = firstPresent(listing, "id", "listingId");
        Optional<String> id = IdentifierNormalizer.normalizeNode(rawId, listing);
        if (id.isEmpty()) {
            log.warn("Dropping listing with unresolvable id {}", rawId);
            return Optional.empty();
        }

        String title = firstText(
            text(listing, "title"),
            text(listing, "name"),
            text(listing, "localizedTitle"),
            text(listing.path("presentation"), "title"),
            text(item, "title"),
            text(item, "name")
        );

        String price = null;
        String discountedPrice = null;
        String originalPrice = null;
        JsonNode displayPrice = objectOrNull(item.get("structuredDisplayPrice"));
        if (displayPrice == null) {
            displayPrice = objectOrNull(listing.get("structuredDisplayPrice"));
        }
        if (displayPrice != null) {
            JsonNode primaryLine = displayPrice.path("primaryLine");
            price = firstText(text(primaryLine, "price"), text(primaryLine, "priceString"), text(primaryLine, "displayPrice"));
            discountedPrice = text(primaryLine, "discountedPrice");
            originalPrice = text(primaryLine, "originalPrice");
        }
        if (price == null) {
            for (JsonNode node : List.of(item, listing)) {
                price = firstText(
                    text(node.path("price"), "amountFormatted"),
                    text(node.path("pricingQuote"), "priceString"),
                    text(node.path("priceMetadata"), "displayRate"),
                    text(node, "displayPrice"),
                    text(node, "price")
                );
                if (price != null) {
                    break;
                }
            }
        }

        JsonNode overrides = item.path("listingParamOverrides");
        String link = listingBaseUrl + "/" + id.get();
        return Optional.of(new SearchRecord(
            id.get(),
            textOrDefault(listing, "listingObjType", DEFAULT_OBJECT_TYPE),
            textOrDefault(listing, "roomTypeCategory", DEFAULT_ROOM_TYPE),
            title,
            title,
            resolvePicture(item, listing),
            text(overrides, "checkin"),
            text(overrides, "checkout"),
            price,
            discountedPrice,
            originalPrice,
            link,
            text(overrides, "categoryTag"),
            text(overrides, "photoId")
        ));
    }

    static JsonNode resolveListing(JsonNode item) {
        JsonNode nested = item.get("listing");
        if (nested != null && nested.isObject()) {
            return nested;
        }
        if (isTruthy(item.get("id")) || isTruthy(item.get("listingId"))) {
            return item;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isObject() && (isTruthy(value.get("id")) || isTruthy(value.get("listingId")))) {
                return value;
            }
        }
        return null;
    }

    private static String resolvePicture(JsonNode item, JsonNode listing) {
        for (String field : PICTURE_LISTS) {
            JsonNode pictures = nonEmptyArray(item.get(field));
            if (pictures == null) {
                pictures = nonEmptyArray(listing.get(field));
            }
            if (pictures == null || !pictures.get(0).isObject()) {
                continue;
            }
            JsonNode first = pictures.get(0);
            for (String key : PICTURE_LIST_FIELDS) {
                String url = text(first, key);
                if (url != null) {
                    return url;
                }
            }
        }
        for (String field : PICTURE_SINGLES) {
            JsonNode picture = item.get(field);
            if (!isTruthy(picture)) {
                picture = listing.get(field);
            }
            if (picture == null) {
                continue;
            }
            String url = picture.isObject()
                ? firstText(text(picture, "url"), text(picture, "src"))
                : (picture.isTextual() && !picture.textValue().isBlank() ? picture.textValue() : null);
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (isTruthy(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isTruthy(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0.0;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.size() > 0;
    }

    private static JsonNode objectOrNull(JsonNode node) {
        return node != null && node.isObject() && node.size() > 0 ? node : null;
    }

    private static JsonNode nonEmptyArray(JsonNode node) {
        return node != null && node.isArray() && node.size() > 0 ? node : null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.textValue().isBlank()) {
            return null;
        }
        return value.textValue();
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return fallback;
        }
        return value.asText();
    }

    private static String firstText(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String fieldNames(JsonNode node) {
        StringBuilder names = new StringBuilder();
        node.fieldNames().forEachRemaining(name -> {
            if (names.length() > 0) {
                names.append(',');
            }
            names.append(name);
        });
        return names.toString();
    }
}
