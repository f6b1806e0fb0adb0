package com.stayharvest.crawl.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.stayharvest.crawl.extract.ListingValidator;
import com.stayharvest.crawl.http.FetchExhaustedException;
import com.stayharvest.crawl.http.ProviderRequestFactory;
import com.stayharvest.crawl.http.RetryingFetcher;
import com.stayharvest.crawl.model.DetailHints;
import com.stayharvest.crawl.model.DetailRecord;
import com.stayharvest.crawl.model.SessionMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Fetches the per-listing detail document and maps its sections onto a {@link DetailRecord}.
 * An empty result means the listing was skipped; the caller keeps the basic record.
 */
@Service
public class DetailEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(DetailEnrichmentService.class);

    static final String SECTION_AVAILABILITY = "AVAILABILITY_CALENDAR_DEFAULT";
    static final String SECTION_REVIEWS = "REVIEWS_DEFAULT";
    static final String SECTION_LOCATION = "LOCATION_DEFAULT";
    static final String SECTION_HOST = "MEET_YOUR_HOST";
    static final String SECTION_LUXE = "LUXE_BANNER";

    private final ProviderRequestFactory requestFactory;
    private final RetryingFetcher fetcher;
    private final ListingValidator validator;

    public DetailEnrichmentService(
        ProviderRequestFactory requestFactory,
        RetryingFetcher fetcher,
        ListingValidator validator
    ) {
        this.requestFactory = requestFactory;
        this.fetcher = fetcher;
        this.validator = validator;
    }

    public Optional<DetailRecord> enrich(SessionMaterial session, String id, DetailHints hints) {
        if (session == null || !session.hasItemToken()) {
            log.warn("No item capability token available; skipping detail for listing {}", id);
            return Optional.empty();
        }
        log.info("Downloading detail for listing {} | {}", id, hints == null ? null : hints.link());
        JsonNode document;
        try {
            document = fetcher.fetchJson(requestFactory.detailRequest(session, id, hints));
        } catch (FetchExhaustedException e) {
            log.warn("Detail fetch for listing {} gave up: {}", id, e.getMessage());
            return Optional.empty();
        }
        Optional<DetailRecord> detail = parse(id, document);
        detail.ifPresent(record -> validator.validate(id, record));
        return detail;
    }

    Optional<DetailRecord> parse(String id, JsonNode document) {
        if (document == null || !document.isObject()) {
            return Optional.empty();
        }
        JsonNode errors = document.get("errors");
        if (errors != null && !errors.isNull() && (!errors.isContainerNode() || errors.size() > 0)) {
            log.error("Detail response for listing {} carries errors: {}", id, abbreviate(errors.toString()));
            return Optional.empty();
        }
        JsonNode page = document.path("data").path("presentation").path("stayProductDetailPage");
        if (!page.isObject() || page.size() == 0) {
            log.info("No detail payload for listing {}; skipping", id);
            return Optional.empty();
        }

        JsonNode mainSections = page.path("sections");
        JsonNode sections = JsonNodeFactory.instance.arrayNode();
        if (mainSections.isObject()) {
            JsonNode nested = mainSections.path("sections");
            if (!nested.isMissingNode() && !nested.isNull()) {
                sections = nested;
            }
        } else if (mainSections.isArray()) {
            sections = mainSections;
        }
        if (!sections.isArray()) {
            log.info("Unexpected sections structure for listing {}; skipping", id);
            return Optional.empty();
        }

        DetailBuilder builder = new DetailBuilder();
        JsonNode sbuiSections = mainSections.path("sbuiData").path("sectionConfiguration").path("root").path("sections");
        if (sbuiSections.isArray()) {
            for (JsonNode section : sbuiSections) {
                if (SECTION_LUXE.equals(section.path("sectionId").asText(null))) {
                    builder.luxe = true;
                }
            }
        }
        for (JsonNode section : sections) {
            if (section == null || !section.isObject()) {
                continue;
            }
            String sectionId = section.path("sectionId").asText("");
            JsonNode data = section.path("section");
            switch (sectionId) {
                case SECTION_AVAILABILITY -> {
                    builder.location = text(data, "localizedLocation");
                    builder.maxGuestCapacity = data.path("maxGuestCapacity").asInt(0);
                }
                case SECTION_REVIEWS -> {
                    builder.guestFavorite = data.path("isGuestFavorite").asBoolean(false);
                    builder.reviewsCount = data.path("overallCount").asInt(builder.reviewsCount);
                    builder.averageRating = data.path("overallRating").asDouble(builder.averageRating);
                }
                case SECTION_LOCATION -> {
                    builder.lat = number(data, "lat");
                    builder.lng = number(data, "lng");
                }
                case SECTION_HOST -> readHost(data.path("cardData"), builder);
                default -> {
                }
            }
        }
        return Optional.of(builder.build());
    }

    private void readHost(JsonNode card, DetailBuilder builder) {
        if (!card.isObject()) {
            return;
        }
        String name = text(card, "name");
        if (name != null) {
            builder.host = name;
        }
        builder.superhost = card.path("isSuperhost").asBoolean(builder.superhost);
        builder.verified = card.path("isVerified").asBoolean(builder.verified);
        builder.hostRatingCount = card.path("ratingCount").asInt(builder.hostRatingCount);
        String userId = text(card, "userId");
        if (userId != null) {
            builder.hostUserId = decodeUserId(userId);
        }
        JsonNode timeAsHost = card.path("timeAsHost");
        builder.hostYears = timeAsHost.path("years").asInt(0);
        builder.hostMonths = timeAsHost.path("months").asInt(0);
        builder.hostRatingAverage = card.path("ratingAverage").asDouble(builder.hostRatingAverage);
    }

    static String decodeUserId(String encoded) {
        try {
            String decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
            String[] parts = decoded.split(":");
            return parts.length == 0 ? decoded : parts[parts.length - 1];
        } catch (IllegalArgumentException e) {
            return encoded;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.doubleValue() : null;
    }

    private static String abbreviate(String value) {
        return value.length() <= 1000 ? value : value.substring(0, 1000);
    }

    private static final class DetailBuilder {
        private int reviewsCount;
        private double averageRating;
        private String host;
        private boolean luxe;
        private String location;
        private int maxGuestCapacity;
        private boolean guestFavorite;
        private Double lat;
        private Double lng;
        private boolean superhost;
        private boolean verified;
        private int hostRatingCount;
        private String hostUserId;
        private int hostYears;
        private int hostMonths;
        private double hostRatingAverage;

        private DetailRecord build() {
            return new DetailRecord(
                reviewsCount,
                averageRating,
                host,
                luxe,
                location,
                maxGuestCapacity,
                guestFavorite,
                lat,
                lng,
                superhost,
                verified,
                hostRatingCount,
                hostUserId,
                hostYears,
                hostMonths,
                hostRatingAverage
            );
        }
    }
}
