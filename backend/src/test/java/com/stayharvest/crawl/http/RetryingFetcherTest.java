package com.stayharvest.crawl.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.ProviderRequest;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RetryingFetcherTest {
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void retriesServerErrorsAndNonJsonBodiesUntilJsonArrives() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>captcha</html>"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\": {\"ok\": true}}"));

        JsonNode document = fetcher(5).fetchJson(request("POST", "{\"q\": 1}"));

        assertThat(document.path("data").path("ok").asBoolean()).isTrue();
        assertEquals(3, server.getRequestCount());
        RecordedRequest first = server.takeRequest();
        assertEquals("POST", first.getMethod());
        assertEquals("{\"q\": 1}", first.getBody().readUtf8());
        assertEquals("session-value", first.getHeader("x-custom"));
        assertThat(first.getHeader("User-Agent")).isNotBlank();
    }

    @Test
    void givesUpAfterMaxAttempts() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        assertThatThrownBy(() -> fetcher(2).fetchJson(request("GET", null)))
            .isInstanceOfSatisfying(FetchExhaustedException.class, e -> {
                assertEquals(2, e.getAttempts());
                assertEquals(500, e.getLastStatus());
                assertEquals("http_500", e.getLastError());
            });
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void scalarJsonBodiesAreNotAcceptedAsDocuments() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("\"just a string\""));

        assertThatThrownBy(() -> fetcher(1).fetchJson(request("GET", null)))
            .isInstanceOfSatisfying(FetchExhaustedException.class, e -> assertEquals("non_json_body", e.getLastError()));
    }

    @Test
    void backoffIsCappedAndJittered() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setRetryBaseDelayMs(100);
        properties.setRetryMaxDelayMs(1000);
        RetryingFetcher fetcher = new RetryingFetcher(properties, httpClient(), new ObjectMapper());

        assertThat(fetcher.backoffDelayMs(0)).isBetween(100L, 199L);
        assertThat(fetcher.backoffDelayMs(2)).isBetween(400L, 499L);
        assertThat(fetcher.backoffDelayMs(20)).isBetween(1000L, 1099L);

        properties.setRetryBaseDelayMs(0);
        assertEquals(0L, fetcher.backoffDelayMs(3));
    }

    private RetryingFetcher fetcher(int maxRetries) {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setMaxRetries(maxRetries);
        properties.setRetryBaseDelayMs(0);
        properties.setRequestTimeoutSeconds(5);
        return new RetryingFetcher(properties, httpClient(), new ObjectMapper());
    }

    private static HttpClient httpClient() {
        return HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    private ProviderRequest request(String method, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-custom", "session-value");
        headers.put(":authority", "ignored");
        headers.put("Host", "ignored");
        return new ProviderRequest("test " + method, method, server.url("/api/v3/op").uri(), headers, body);
    }
}
