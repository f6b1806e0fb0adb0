package com.stayharvest.crawl.model;

import java.util.Map;

/**
 * Opaque session state harvested from a live client: capability tokens, header bag and viewport.
 */
public record SessionMaterial(
    String searchToken,
    String itemToken,
    String apiKey,
    String clientVersion,
    String clientRequestId,
    Map<String, String> headers,
    int viewportWidthPx,
    int viewportHeightPx,
    String locale,
    String currency
) {
    public SessionMaterial {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean hasSearchToken() {
        return searchToken != null && !searchToken.isBlank();
    }

    public boolean hasItemToken() {
        return itemToken != null && !itemToken.isBlank();
    }
}
