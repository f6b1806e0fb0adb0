package com.stayharvest.crawl.model;

import java.net.URI;
import java.util.Map;

public record ProviderRequest(
    String label,
    String method,
    URI uri,
    Map<String, String> headers,
    String body
) {
    public boolean isPost() {
        return "POST".equalsIgnoreCase(method);
    }
}
