package com.stayharvest.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.SearchPage;
import com.stayharvest.crawl.model.SearchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls listings, the next-page cursor and paging metadata out of a search response whose layout
 * drifts between provider releases. Known result paths are tried first; when none of them match, a
 * bounded deep scan looks for listing-shaped nodes anywhere in the results object.
 */
@Component
public class ResponseExtractor {
    private static final Logger log = LoggerFactory.getLogger(ResponseExtractor.class);

    static final List<List<String>> DATA_ROOTS = List.of(
        List.of("data", "presentation", "staysSearch"),
        List.of("data", "staysSearch"),
        List.of("data", "presentation", "explore"),
        List.of("data", "presentation", "search"),
        List.of("data", "explore", "sections", "sectionedResults")
    );
    static final List<List<String>> RESULT_PATHS = List.of(
        List.of("searchResults"),
        List.of("staysSearchResults", "searchResults"),
        List.of("staysSearchResultsV2", "searchResults"),
        List.of("staysMapSearchResults", "mapResults"),
        List.of("staysMapSearchResultsV2", "mapResults"),
        List.of("sectionedResults"),
        List.of("results"),
        List.of("mapResults"),
        List.of("listings"),
        List.of("items"),
        List.of("exploreItems")
    );
    static final List<String> PAGINATION_KEYS = List.of("paginationInfo", "pageInfo", "pagination", "pagingInfo");
    static final List<String> CURSOR_KEYS = List.of("nextPageCursor", "nextCursor", "nextPageToken", "cursor", "next");
    static final List<String> PAGE_LIST_KEYS = List.of("pageCursors", "cursors", "pages");

    private final JsonTreeScanner scanner;
    private final SearchResultMapper mapper;

    @Autowired
    public ResponseExtractor(HarvesterProperties properties) {
        this(new JsonTreeScanner(), new SearchResultMapper(properties.getProvider().getListingBaseUrl()));
    }

    ResponseExtractor(JsonTreeScanner scanner, SearchResultMapper mapper) {
        this.scanner = scanner;
        this.mapper = mapper;
    }

    public SearchPage extract(JsonNode document) {
        if (document == null || !document.isContainerNode()) {
            return SearchPage.empty();
        }
        try {
            return extractPage(document);
        } catch (RuntimeException e) {
            log.warn("Search response could not be parsed: {}", e.toString());
            return SearchPage.empty();
        }
    }

    private SearchPage extractPage(JsonNode document) {
        JsonNode dataRoot = locateDataRoot(document);
        if (dataRoot == null) {
            log.warn("No known data root in search response; scanning the whole document");
            dataRoot = document;
        }
        JsonNode resultsNode = dataRoot.get("results");
        JsonNode results = resultsNode != null && resultsNode.isContainerNode() && resultsNode.size() > 0
            ? resultsNode
            : dataRoot;

        boolean deepScanUsed = false;
        List<JsonNode> candidates = collectFromKnownPaths(results);
        if (candidates.isEmpty()) {
            deepScanUsed = true;
            candidates = scanner.collectListingCandidates(results);
            log.debug("Known result paths empty; deep scan found {} candidates", candidates.size());
        }

        Map<String, SearchRecord> records = new LinkedHashMap<>();
        for (JsonNode candidate : candidates) {
            Optional<SearchRecord> mapped = mapper.map(candidate);
            mapped.ifPresent(record -> records.putIfAbsent(record.id(), record));
        }

        JsonNode pagination = locatePagination(results);
        String nextCursor = readCursor(pagination);
        int totalPages = readTotalPages(pagination);
        String federatedSearchId = readFederatedSearchId(results);

        if (totalPages > 0 && records.isEmpty()) {
            log.warn("Response reports {} pages but no listings were extracted ({} candidates)", totalPages, candidates.size());
        }
        return new SearchPage(
            List.copyOf(records.values()),
            nextCursor,
            totalPages,
            federatedSearchId,
            candidates.size(),
            deepScanUsed
        );
    }

    static JsonNode locateDataRoot(JsonNode document) {
        for (List<String> path : DATA_ROOTS) {
            JsonNode node = navigate(document, path);
            if (node != null && node.isObject() && node.size() > 0) {
                return node;
            }
        }
        return null;
    }

    private static List<JsonNode> collectFromKnownPaths(JsonNode results) {
        List<JsonNode> candidates = new ArrayList<>();
        if (!results.isObject()) {
            return candidates;
        }
        for (List<String> path : RESULT_PATHS) {
            JsonNode node = navigate(results, path);
            if (node != null && node.isArray()) {
                node.forEach(candidates::add);
                log.debug("Result path {} yielded {} items", String.join(".", path), node.size());
            }
        }
        return candidates;
    }

    private JsonNode locatePagination(JsonNode results) {
        if (results.isObject()) {
            for (String key : PAGINATION_KEYS) {
                JsonNode value = results.get(key);
                if (value != null && value.isContainerNode()) {
                    return value;
                }
            }
        }
        return scanner.findFirstContainerUnder(results, PAGINATION_KEYS).orElse(null);
    }

    static String readCursor(JsonNode pagination) {
        if (pagination == null) {
            return null;
        }
        if (pagination.isObject()) {
            for (String key : CURSOR_KEYS) {
                String value = scalarText(pagination.get(key));
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
        if (pagination.isArray() && pagination.size() > 0) {
            JsonNode last = pagination.get(pagination.size() - 1);
            if (last.isObject()) {
                String cursor = scalarText(last.get("cursor"));
                return cursor != null ? cursor : scalarText(last.get("nextPageCursor"));
            }
        }
        return null;
    }

    static int readTotalPages(JsonNode pagination) {
        if (pagination == null || !pagination.isObject()) {
            return 0;
        }
        JsonNode pages = null;
        for (String key : PAGE_LIST_KEYS) {
            JsonNode value = pagination.get(key);
            if (value != null && value.isContainerNode() && value.size() > 0) {
                pages = value;
                break;
            }
        }
        if (pages != null && pages.isArray()) {
            return pages.size();
        }
        if (pages != null) {
            int count = pages.path("totalCount").asInt(0);
            return count > 0 ? count : Math.max(0, pages.path("totalPages").asInt(0));
        }
        return Math.max(0, pagination.path("totalPages").asInt(0));
    }

    private String readFederatedSearchId(JsonNode results) {
        String direct = scalarText(results.path("loggingMetadata").path("legacyLoggingContext").get("federatedSearchId"));
        if (direct != null) {
            return direct;
        }
        Optional<JsonNode> context = scanner.findFirstContainerUnder(results, List.of("legacyLoggingContext"));
        if (context.isPresent()) {
            String nested = scalarText(context.get().get("federatedSearchId"));
            if (nested != null) {
                return nested;
            }
        }
        return scanner.findFirstText(results, "federatedSearchId").orElse(null);
    }

    private static JsonNode navigate(JsonNode node, List<String> path) {
        JsonNode current = node;
        for (String key : path) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(key);
        }
        return current;
    }

    private static String scalarText(JsonNode value) {
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
