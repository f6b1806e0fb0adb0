package com.stayharvest.crawl.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.ProviderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sends provider requests and parses the JSON body, retrying with capped exponential backoff.
 * Transport errors, timeouts, non-2xx statuses and bodies that are not JSON all count as a failed attempt.
 */
@Service
public class RetryingFetcher {
    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HarvesterProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public RetryingFetcher(
        HarvesterProperties properties,
        @Qualifier("providerHttpClient") HttpClient client,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    public JsonNode fetchJson(ProviderRequest request) {
        int maxAttempts = properties.getMaxRetries();
        int lastStatus = 0;
        String lastError = null;
        Exception lastException = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new FetchExhaustedException(request.label(), attempt, lastStatus, "interrupted", lastException);
            }
            try {
                HttpResponse<byte[]> response = client.send(buildRequest(request), HttpResponse.BodyHandlers.ofByteArray());
                lastStatus = response.statusCode();
                String body = response.body() == null ? "" : new String(response.body(), StandardCharsets.UTF_8);
                if (lastStatus >= 200 && lastStatus < 300) {
                    JsonNode document = parse(body);
                    if (document != null) {
                        return document;
                    }
                    lastError = "non_json_body";
                } else {
                    lastError = "http_" + lastStatus;
                }
            } catch (HttpTimeoutException e) {
                lastException = e;
                lastError = "timeout";
            } catch (IOException e) {
                lastException = e;
                lastError = "io_error: " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchExhaustedException(request.label(), attempt + 1, lastStatus, "interrupted", e);
            }
            log.warn("({}/{}) {} attempt failed: status={}, error={}", attempt + 1, maxAttempts, request.label(), lastStatus, lastError);
            if (attempt + 1 < maxAttempts && !sleepBackoff(attempt)) {
                throw new FetchExhaustedException(request.label(), attempt + 1, lastStatus, "interrupted", lastException);
            }
        }
        log.error("Maximum tries reached for {}: status={}, error={}", request.label(), lastStatus, lastError);
        throw new FetchExhaustedException(request.label(), maxAttempts, lastStatus, lastError, lastException);
    }

    long backoffDelayMs(int attempt) {
        long base = properties.getRetryBaseDelayMs();
        if (base <= 0) {
            return 0;
        }
        long cap = properties.getRetryMaxDelayMs();
        long delay = base << Math.min(Math.max(0, attempt), 30);
        if (cap > 0) {
            delay = Math.min(delay, cap);
        }
        return delay + ThreadLocalRandom.current().nextLong(base);
    }

    private HttpRequest buildRequest(ProviderRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
        boolean userAgentSet = false;
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            String name = header.getKey();
            if (name == null || name.isBlank() || name.startsWith(":") || header.getValue() == null) {
                continue;
            }
            String lower = name.toLowerCase(Locale.ROOT);
            if (RESTRICTED_HEADERS.contains(lower)) {
                continue;
            }
            userAgentSet |= lower.equals("user-agent");
            builder.header(name, header.getValue());
        }
        if (!userAgentSet) {
            builder.header("User-Agent", properties.getUserAgent());
        }
        if (request.isPost()) {
            return builder
                .POST(HttpRequest.BodyPublishers.ofString(request.body() == null ? "" : request.body(), StandardCharsets.UTF_8))
                .build();
        }
        return builder.GET().build();
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node == null || node.isMissingNode() || !node.isContainerNode() ? null : node;
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private boolean sleepBackoff(int attempt) {
        long delay = backoffDelayMs(attempt);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
