package com.stayharvest.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.stayharvest.crawl.model.SearchPage;
import com.stayharvest.crawl.model.SearchRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseExtractorTest {
    private static final String LISTING_A = """
        {
          "listing": {"id": "U3RheUxpc3Rpbmc6OTg3NjU0MzI=", "title": "Riad near the medina", "roomTypeCategory": "entire_home"},
          "structuredDisplayPrice": {"primaryLine": {"price": "MAD 850", "originalPrice": "MAD 1,000"}},
          "contextualPictures": [{"picture": "https://a0.muscache.com/im/pictures/riad.jpg"}],
          "listingParamOverrides": {"checkin": "2026-11-01", "checkout": "2026-11-06", "categoryTag": "Tag:8678"}
        }
        """;
    private static final String LISTING_B = """
        {
          "listing": {"id": "listing:4455667", "name": "Surf house"},
          "pricingQuote": {"priceString": "MAD 400"}
        }
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseExtractor extractor = new ResponseExtractor(
        new JsonTreeScanner(),
        new SearchResultMapper("https://www.airbnb.com/rooms")
    );

    @Test
    void extractsListingsAndPagingFromKnownLayout() throws Exception {
        SearchPage page = extractor.extract(objectMapper.readTree(legacyDocument()));

        assertFalse(page.deepScanUsed());
        assertEquals(List.of("98765432", "4455667"), ids(page));
        assertEquals("cursor-2", page.nextCursor());
        assertEquals(3, page.totalPages());
        assertEquals("fed-123", page.federatedSearchId());

        SearchRecord riad = page.records().get(0);
        assertEquals("Riad near the medina", riad.title());
        assertEquals("MAD 850", riad.price());
        assertEquals("MAD 1,000", riad.originalPrice());
        assertEquals("entire_home", riad.roomTypeCategory());
        assertEquals("REGULAR", riad.listingObjType());
        assertEquals("https://a0.muscache.com/im/pictures/riad.jpg", riad.picture());
        assertEquals("2026-11-01", riad.checkin());
        assertEquals("Tag:8678", riad.categoryTag());
        assertEquals("https://www.airbnb.com/rooms/98765432", riad.link());

        SearchRecord surf = page.records().get(1);
        assertEquals("Surf house", surf.title());
        assertEquals("MAD 400", surf.price());
        assertEquals("unavailable", surf.roomTypeCategory());
    }

    @Test
    void deepScanFindsTheSameListingsUnderAnUnknownWrapper() throws Exception {
        SearchPage legacy = extractor.extract(objectMapper.readTree(legacyDocument()));
        SearchPage drifted = extractor.extract(objectMapper.readTree("""
            {"data": {"presentation": {"staysSearch": {"results": {
              "experimentalFeed": {"cards": [%s, %s]},
              "pagingInfo": {"nextCursor": "cursor-2", "totalPages": 3},
              "tracking": {"legacyLoggingContext": {"federatedSearchId": "fed-123"}}
            }}}}}
            """.formatted(LISTING_A, LISTING_B)));

        assertTrue(drifted.deepScanUsed());
        assertEquals(legacy.records(), drifted.records());
        assertEquals(legacy.nextCursor(), drifted.nextCursor());
        assertEquals(legacy.totalPages(), drifted.totalPages());
        assertEquals(legacy.federatedSearchId(), drifted.federatedSearchId());
    }

    @Test
    void deepScanWrapsBareListingObjects() throws Exception {
        SearchPage page = extractor.extract(objectMapper.readTree("""
            {"data": {"staysSearch": {"feed": {"section": {"item": {"id": 31337, "title": "Bare listing"}}}}}}
            """));

        assertTrue(page.deepScanUsed());
        assertEquals(List.of("31337"), ids(page));
        assertEquals("Bare listing", page.records().get(0).title());
    }

    @Test
    void collapsesDuplicateIdsKeepingTheFirst() throws Exception {
        String duplicate = """
            {"listing": {"id": "98765432", "title": "Second copy"}}
            """;
        SearchPage page = extractor.extract(objectMapper.readTree("""
            {"data": {"presentation": {"staysSearch": {"results": {"searchResults": [%s, %s]}}}}}
            """.formatted(LISTING_A, duplicate)));

        assertEquals(1, page.records().size());
        assertEquals("Riad near the medina", page.records().get(0).title());
        assertEquals(2, page.candidateCount());
    }

    @Test
    void dropsListingsWithUnresolvableIds() throws Exception {
        SearchPage page = extractor.extract(objectMapper.readTree("""
            {"data": {"presentation": {"staysSearch": {"results": {"searchResults": [
              {"listing": {"id": "aGVsbG8=", "title": "Broken"}},
              %s
            ]}}}}}
            """.formatted(LISTING_B)));

        assertEquals(List.of("4455667"), ids(page));
    }

    @Test
    void malformedInputYieldsAnEmptyPage() throws Exception {
        assertThat(extractor.extract(null).records()).isEmpty();
        assertThat(extractor.extract(TextNode.valueOf("oops")).records()).isEmpty();

        SearchPage page = extractor.extract(objectMapper.readTree("{\"data\": \"oops\", \"errors\": []}"));
        assertThat(page.records()).isEmpty();
        assertNull(page.nextCursor());
        assertEquals(0, page.totalPages());
    }

    @Test
    void readsCursorAndPageCountVariants() throws Exception {
        JsonNode list = objectMapper.readTree("[{\"cursor\": \"p1\"}, {\"cursor\": \"p2\"}]");
        assertEquals("p2", ResponseExtractor.readCursor(list));

        JsonNode nextPageToken = objectMapper.readTree("{\"nextPageToken\": \"tok\", \"pages\": {\"totalCount\": 7}}");
        assertEquals("tok", ResponseExtractor.readCursor(nextPageToken));
        assertEquals(7, ResponseExtractor.readTotalPages(nextPageToken));

        JsonNode plain = objectMapper.readTree("{\"nextPageCursor\": \"\", \"totalPages\": 4}");
        assertNull(ResponseExtractor.readCursor(plain));
        assertEquals(4, ResponseExtractor.readTotalPages(plain));
        assertNull(ResponseExtractor.readCursor(null));
        assertEquals(0, ResponseExtractor.readTotalPages(null));
    }

    private String legacyDocument() {
        return """
            {"data": {"presentation": {"staysSearch": {"results": {
              "searchResults": [%s, %s],
              "paginationInfo": {"nextPageCursor": "cursor-2", "pageCursors": ["cursor-1", "cursor-2", "cursor-3"]},
              "loggingMetadata": {"legacyLoggingContext": {"federatedSearchId": "fed-123"}}
            }}}}}
            """.formatted(LISTING_A, LISTING_B);
    }

    private static List<String> ids(SearchPage page) {
        return page.records().stream().map(SearchRecord::id).collect(Collectors.toList());
    }
}
