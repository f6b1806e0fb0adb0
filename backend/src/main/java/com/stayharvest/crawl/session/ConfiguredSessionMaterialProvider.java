package com.stayharvest.crawl.session;

import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.SessionMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredSessionMaterialProvider implements SessionMaterialProvider {
    private static final Logger log = LoggerFactory.getLogger(ConfiguredSessionMaterialProvider.class);

    private final HarvesterProperties properties;

    public ConfiguredSessionMaterialProvider(HarvesterProperties properties) {
        this.properties = properties;
    }

    @Override
    public SessionMaterial current() {
        HarvesterProperties.Session session = properties.getSession();
        return new SessionMaterial(
            blankToNull(session.getSearchToken()),
            blankToNull(session.getItemToken()),
            blankToNull(session.getApiKey()),
            blankToNull(session.getClientVersion()),
            blankToNull(session.getClientRequestId()),
            session.getHeaders(),
            session.getViewportWidthPx(),
            session.getViewportHeightPx(),
            session.getLocale(),
            session.getCurrency()
        );
    }

    @Override
    public SessionMaterial refresh() {
        log.debug("Session material comes from configuration; refresh re-reads harvester.session");
        return current();
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
