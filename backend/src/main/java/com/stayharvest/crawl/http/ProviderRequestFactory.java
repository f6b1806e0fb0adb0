package com.stayharvest.crawl.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.geo.GeoTileMath;
import com.stayharvest.crawl.model.DetailHints;
import com.stayharvest.crawl.model.ProviderRequest;
import com.stayharvest.crawl.model.SessionMaterial;
import com.stayharvest.crawl.model.Tile;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the persisted-query search and detail requests from session material.
 */
@Component
public class ProviderRequestFactory {
    private static final Set<String> DROPPED_SESSION_HEADERS = Set.of(
        ":authority",
        ":method",
        ":path",
        ":scheme",
        "content-length"
    );
    private static final List<String> TREATMENT_FLAGS = List.of(
        "feed_map_decouple_m11_treatment",
        "recommended_filters_2024_treatment_b",
        "m1_2024_monthly_stays_dial_treatment_flag",
        "recommended_amenities_2024_treatment_b",
        "filter_redesign_2024_treatment",
        "filter_reordering_2024_roomtype_treatment",
        "selected_filters_2024_treatment",
        "m13_search_input_phase2_treatment"
    );

    private final HarvesterProperties properties;
    private final ObjectMapper objectMapper;

    public ProviderRequestFactory(HarvesterProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ProviderRequest searchRequest(SessionMaterial session, Tile tile, String pageCursor) {
        HarvesterProperties.Provider provider = properties.getProvider();
        String operation = provider.getSearchOperation();
        int zoom = GeoTileMath.zoomLevel(
            tile.swLat(),
            tile.swLng(),
            tile.neLat(),
            tile.neLng(),
            session.viewportWidthPx(),
            session.viewportHeightPx()
        );

        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("aiSearchEnabled", false);
        variables.set("staysSearchRequest", searchBlock(tile, zoom, pageCursor, true));
        variables.set("staysMapSearchRequestV2", searchBlock(tile, zoom, pageCursor, false));
        variables.put("isLeanTreatment", false);
        variables.put("skipExtendedSearchParams", false);
        variables.put("includeDemandStayListing", true);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("operationName", operation);
        payload.set("variables", variables);
        payload.set("extensions", persistedQuery(session.searchToken()));

        Map<String, String> headers = baseHeaders(session);
        headers.put("content-type", "application/json");
        URI uri = URI.create(
            provider.getBaseUrl() + "/api/v3/" + operation + "/" + encode(session.searchToken())
                + "?operationName=" + encode(operation)
                + "&locale=" + encode(session.locale())
                + "&currency=" + encode(session.currency())
        );
        return new ProviderRequest("search tile " + tile.ordinal(), "POST", uri, headers, write(payload));
    }

    public ProviderRequest detailRequest(SessionMaterial session, String id, DetailHints hints) {
        HarvesterProperties.Provider provider = properties.getProvider();
        String operation = provider.getDetailOperation();
        DetailHints safeHints = hints == null ? DetailHints.forLink(null, null) : hints;

        ObjectNode sectionsRequest = objectMapper.createObjectNode();
        sectionsRequest.put("adults", "1");
        sectionsRequest.put("children", "0");
        sectionsRequest.put("infants", "0");
        sectionsRequest.put("pets", 0);
        sectionsRequest.put("bypassTargetings", false);
        sectionsRequest.put("categoryTag", safeHints.categoryTag());
        sectionsRequest.put("federatedSearchId", safeHints.federatedSearchId());
        sectionsRequest.put("photoId", safeHints.photoId());
        sectionsRequest.put("checkIn", safeHints.checkin());
        sectionsRequest.put("checkOut", safeHints.checkout());
        sectionsRequest.put("hostPreview", false);
        sectionsRequest.put("preview", false);
        sectionsRequest.put("privateBooking", false);
        sectionsRequest.put("translateUgc", false);
        sectionsRequest.put("useNewSectionWrapperApi", false);
        sectionsRequest.putNull("sectionIds");
        ArrayNode layouts = sectionsRequest.putArray("layouts");
        layouts.add("SIDEBAR");
        layouts.add("SINGLE_COLUMN");
        sectionsRequest.put("p3ImpressionId", "p3_" + Instant.now().getEpochSecond());

        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("id", encodeListingGlobalId(id));
        variables.put("useContextualUser", false);
        variables.set("pdpSectionsRequest", sectionsRequest);

        Map<String, String> headers = baseHeaders(session);
        if (safeHints.link() != null) {
            headers.put("referer", safeHints.link());
        }
        URI uri = URI.create(
            provider.getBaseUrl() + "/api/v3/" + operation + "/" + encode(session.itemToken())
                + "?operationName=" + encode(operation)
                + "&locale=" + encode(session.locale())
                + "&currency=" + encode(session.currency())
                + "&variables=" + encode(write(variables))
                + "&extensions=" + encode(write(persistedQuery(session.itemToken())))
        );
        return new ProviderRequest("detail " + id, "GET", uri, headers, null);
    }

    public static String encodeListingGlobalId(String id) {
        return Base64.getEncoder().encodeToString(("StayListing:" + id).getBytes(StandardCharsets.UTF_8));
    }

    private ObjectNode searchBlock(Tile tile, int zoom, String pageCursor, boolean listRequest) {
        HarvesterProperties.Provider provider = properties.getProvider();
        ObjectNode block = objectMapper.createObjectNode();
        if (listRequest) {
            block.put("maxMapItems", 9999);
        }
        block.put("requestedPageType", "STAYS_SEARCH");
        block.put("metadataOnly", false);
        ArrayNode flags = block.putArray("treatmentFlags");
        TREATMENT_FLAGS.forEach(flags::add);
        block.put("searchType", "user_map_move");

        ArrayNode rawParams = block.putArray("rawParams");
        addParam(rawParams, "adults", "1");
        addParam(rawParams, "cdnCacheSafe", "false");
        addParam(rawParams, "channel", "EXPLORE");
        if (listRequest) {
            addParam(rawParams, "itemsPerGrid", Integer.toString(provider.getItemsPerGrid()));
        }
        addParam(rawParams, "neLat", Double.toString(tile.neLat()));
        addParam(rawParams, "neLng", Double.toString(tile.neLng()));
        addParam(rawParams, "query", provider.getQuery());
        addParam(rawParams, "refinementPaths", "/homes");
        addParam(rawParams, "screenSize", "large");
        addParam(rawParams, "searchByMap", "true");
        addParam(rawParams, "searchMode", "regular_search");
        addParam(rawParams, "swLat", Double.toString(tile.swLat()));
        addParam(rawParams, "swLng", Double.toString(tile.swLng()));
        addParam(rawParams, "tabId", "home_tab");
        addParam(rawParams, "zoomLevel", Integer.toString(zoom));
        block.putArray("skipHydrationListingIds");
        if (pageCursor != null) {
            block.put("cursor", pageCursor);
        }
        return block;
    }

    private void addParam(ArrayNode rawParams, String name, String value) {
        ObjectNode param = rawParams.addObject();
        param.put("filterName", name);
        param.putArray("filterValues").add(value);
    }

    private ObjectNode persistedQuery(String token) {
        ObjectNode extensions = objectMapper.createObjectNode();
        ObjectNode persisted = extensions.putObject("persistedQuery");
        persisted.put("version", 1);
        persisted.put("sha256Hash", token);
        return extensions;
    }

    private Map<String, String> baseHeaders(SessionMaterial session) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : session.headers().entrySet()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            if (name.startsWith(":") || DROPPED_SESSION_HEADERS.contains(name)) {
                continue;
            }
            headers.put(name, entry.getValue());
        }
        headers.put("origin", properties.getProvider().getBaseUrl());
        headers.put("x-airbnb-supports-airlock-v2", "true");
        headers.put("x-airbnb-graphql-platform", "web");
        headers.put("x-airbnb-graphql-platform-client", "minimalist-niobe");
        headers.put("x-csrf-without-token", "1");
        putIfPresent(headers, "x-airbnb-api-key", session.apiKey());
        putIfPresent(headers, "x-client-version", session.clientVersion());
        putIfPresent(headers, "x-client-request-id", session.clientRequestId());
        headers.putIfAbsent("accept-language", "en-US,en;q=0.9");
        return headers;
    }

    private static void putIfPresent(Map<String, String> headers, String name, String value) {
        if (value != null && !value.isBlank()) {
            headers.put(name, value);
        }
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request payload", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
