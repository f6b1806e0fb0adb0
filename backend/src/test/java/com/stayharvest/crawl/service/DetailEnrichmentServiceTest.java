package com.stayharvest.crawl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.extract.ListingValidator;
import com.stayharvest.crawl.http.FetchExhaustedException;
import com.stayharvest.crawl.http.ProviderRequestFactory;
import com.stayharvest.crawl.http.RetryingFetcher;
import com.stayharvest.crawl.model.DetailHints;
import com.stayharvest.crawl.model.DetailRecord;
import com.stayharvest.crawl.model.ProviderRequest;
import com.stayharvest.crawl.model.SessionMaterial;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetailEnrichmentServiceTest {
    private static final String FULL_DETAIL = """
        {"data": {"presentation": {"stayProductDetailPage": {"sections": {
          "sbuiData": {"sectionConfiguration": {"root": {"sections": [{"sectionId": "LUXE_BANNER"}]}}},
          "sections": [
            {"sectionId": "AVAILABILITY_CALENDAR_DEFAULT", "section": {"localizedLocation": "Essaouira, Morocco", "maxGuestCapacity": 6}},
            {"sectionId": "REVIEWS_DEFAULT", "section": {"isGuestFavorite": true, "overallCount": 87, "overallRating": 4.93}},
            {"sectionId": "LOCATION_DEFAULT", "section": {"lat": 31.51, "lng": -9.77}},
            {"sectionId": "MEET_YOUR_HOST", "section": {"cardData": {
              "name": "Amina", "isSuperhost": true, "isVerified": true, "ratingCount": 140,
              "userId": "VXNlcjo0MjQyNDI=", "timeAsHost": {"years": 5, "months": 3}, "ratingAverage": 4.88
            }}},
            {"sectionId": "PHOTO_TOUR", "section": {}}
          ]
        }}}}}
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ProviderRequestFactory requestFactory;
    @Mock
    private RetryingFetcher fetcher;

    private DetailEnrichmentService service;

    @BeforeEach
    void setUp() {
        service = new DetailEnrichmentService(requestFactory, fetcher, new ListingValidator(new HarvesterProperties()));
    }

    @Test
    void mapsAllKnownSections() throws Exception {
        DetailRecord detail = service.parse("12345", objectMapper.readTree(FULL_DETAIL)).orElseThrow();

        assertTrue(detail.luxe());
        assertEquals("Essaouira, Morocco", detail.location());
        assertEquals(6, detail.maxGuestCapacity());
        assertTrue(detail.guestFavorite());
        assertEquals(87, detail.reviewsCount());
        assertEquals(4.93, detail.averageRating());
        assertEquals(31.51, detail.lat());
        assertEquals(-9.77, detail.lng());
        assertEquals("Amina", detail.host());
        assertTrue(detail.superhost());
        assertTrue(detail.verified());
        assertEquals(140, detail.hostRatingCount());
        assertEquals("424242", detail.hostUserId());
        assertEquals(5, detail.hostYears());
        assertEquals(3, detail.hostMonths());
        assertEquals(4.88, detail.hostRatingAverage());
    }

    @Test
    void missingSectionsKeepZeroDefaults() throws Exception {
        Optional<DetailRecord> detail = service.parse("12345", objectMapper.readTree("""
            {"data": {"presentation": {"stayProductDetailPage": {"sections": {"sections": [
              {"sectionId": "LOCATION_DEFAULT", "section": {"lat": "n/a"}}
            ]}}}}}
            """));

        assertThat(detail).contains(DetailRecord.empty());
    }

    @Test
    void acceptsTopLevelSectionArray() throws Exception {
        DetailRecord detail = service.parse("12345", objectMapper.readTree("""
            {"data": {"presentation": {"stayProductDetailPage": {"sections": [
              {"sectionId": "REVIEWS_DEFAULT", "section": {"overallCount": 3, "overallRating": 4.0}}
            ]}}}}
            """)).orElseThrow();

        assertEquals(3, detail.reviewsCount());
        assertFalse(detail.luxe());
        assertNull(detail.host());
    }

    @Test
    void skipsErrorsMissingPagesAndMalformedSections() throws Exception {
        assertThat(service.parse("1", objectMapper.readTree("{\"errors\": [{\"message\": \"boom\"}]}"))).isEmpty();
        assertThat(service.parse("1", objectMapper.readTree("{\"data\": {\"presentation\": {}}}"))).isEmpty();
        assertThat(service.parse("1", objectMapper.readTree(
            "{\"data\": {\"presentation\": {\"stayProductDetailPage\": {\"sections\": {\"sections\": \"oops\"}}}}}"
        ))).isEmpty();
        assertThat(service.parse("1", null)).isEmpty();
    }

    @Test
    void enrichFetchesAndParses() throws Exception {
        ProviderRequest request = new ProviderRequest("detail 12345", "GET", URI.create("http://localhost/detail"), Map.of(), null);
        when(requestFactory.detailRequest(any(SessionMaterial.class), anyString(), any(DetailHints.class))).thenReturn(request);
        when(fetcher.fetchJson(request)).thenReturn(objectMapper.readTree(FULL_DETAIL));

        Optional<DetailRecord> detail = service.enrich(session("item-hash"), "12345", DetailHints.forLink("link", "title"));

        assertThat(detail).isPresent();
        assertEquals("Amina", detail.get().host());
    }

    @Test
    void enrichSkipsWhenFetchIsExhausted() {
        ProviderRequest request = new ProviderRequest("detail 12345", "GET", URI.create("http://localhost/detail"), Map.of(), null);
        when(requestFactory.detailRequest(any(SessionMaterial.class), anyString(), any(DetailHints.class))).thenReturn(request);
        when(fetcher.fetchJson(request)).thenThrow(new FetchExhaustedException("detail 12345", 15, 503, "http_503", null));

        assertThat(service.enrich(session("item-hash"), "12345", DetailHints.forLink("link", "title"))).isEmpty();
    }

    @Test
    void enrichSkipsWithoutItemToken() {
        assertThat(service.enrich(session(null), "12345", DetailHints.forLink("link", "title"))).isEmpty();
        verifyNoInteractions(requestFactory, fetcher);
    }

    @Test
    void decodesHostUserIdOrKeepsRawValue() {
        assertEquals("424242", DetailEnrichmentService.decodeUserId("VXNlcjo0MjQyNDI="));
        assertEquals("not base64!", DetailEnrichmentService.decodeUserId("not base64!"));
    }

    private static SessionMaterial session(String itemToken) {
        return new SessionMaterial("search-hash", itemToken, null, null, null, Map.of(), 1400, 900, "en", "MAD");
    }
}
