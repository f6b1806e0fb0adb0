package com.stayharvest.crawl.session;

import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.SessionMaterial;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfiguredSessionMaterialProviderTest {

    @Test
    void readsConfiguredSessionAndTreatsBlankTokensAsMissing() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getSession().setSearchToken("  search-hash ");
        properties.getSession().setItemToken("   ");
        properties.getSession().setApiKey("api-key");
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("accept-language", "fr-FR");
        properties.getSession().setHeaders(headers);

        SessionMaterial session = new ConfiguredSessionMaterialProvider(properties).current();

        assertTrue(session.hasSearchToken());
        assertEquals("search-hash", session.searchToken());
        assertFalse(session.hasItemToken());
        assertNull(session.itemToken());
        assertEquals("api-key", session.apiKey());
        assertEquals("fr-FR", session.headers().get("accept-language"));
        assertEquals(1400, session.viewportWidthPx());
        assertEquals(900, session.viewportHeightPx());
        assertEquals("MAD", session.currency());
    }

    @Test
    void refreshRereadsConfiguration() {
        HarvesterProperties properties = new HarvesterProperties();
        ConfiguredSessionMaterialProvider provider = new ConfiguredSessionMaterialProvider(properties);
        assertFalse(provider.current().hasSearchToken());

        properties.getSession().setSearchToken("rotated");

        assertEquals("rotated", provider.refresh().searchToken());
    }
}
