package com.stayharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private String userAgent;
    private int maxRetries = 15;
    private int retryBaseDelayMs = 1000;
    private int retryMaxDelayMs = 30000;
    private int requestTimeoutSeconds = 30;
    private int tileFreshnessWindowDays = 30;
    private int recordFreshnessWindowDays = 30;
    private int tilesPerRun = 20;
    private int maxNewRecordsPerRun = 3;
    private int maxDetailEnrichmentsPerRun = 3;
    private int interRequestDelayMinMs = 1000;
    private int interRequestDelayMaxMs = 2000;
    private int interTileDelayMs = 1500;
    private int fullPageThreshold = 13;
    private int maxPagesPerTile = 50;
    private double maxTileSpanDegrees = 5.0;
    private int sessionRefreshEveryTiles = 10;
    private boolean detailBackfillEnabled = false;
    private String tileFile = "geo_data/tiles.txt";
    private Region region = new Region();
    private Provider provider = new Provider();
    private Session session = new Session();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxRetries() {
        return Math.max(1, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(1, maxRetries);
    }

    public int getRetryBaseDelayMs() {
        return Math.max(0, retryBaseDelayMs);
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
    }

    public int getRetryMaxDelayMs() {
        return Math.max(0, retryMaxDelayMs);
    }

    public void setRetryMaxDelayMs(int retryMaxDelayMs) {
        this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getTileFreshnessWindowDays() {
        return Math.max(0, tileFreshnessWindowDays);
    }

    public void setTileFreshnessWindowDays(int tileFreshnessWindowDays) {
        this.tileFreshnessWindowDays = Math.max(0, tileFreshnessWindowDays);
    }

    public int getRecordFreshnessWindowDays() {
        return Math.max(0, recordFreshnessWindowDays);
    }

    public void setRecordFreshnessWindowDays(int recordFreshnessWindowDays) {
        this.recordFreshnessWindowDays = Math.max(0, recordFreshnessWindowDays);
    }

    public int getTilesPerRun() {
        return Math.max(1, tilesPerRun);
    }

    public void setTilesPerRun(int tilesPerRun) {
        this.tilesPerRun = Math.max(1, tilesPerRun);
    }

    public int getMaxNewRecordsPerRun() {
        return Math.max(0, maxNewRecordsPerRun);
    }

    public void setMaxNewRecordsPerRun(int maxNewRecordsPerRun) {
        this.maxNewRecordsPerRun = Math.max(0, maxNewRecordsPerRun);
    }

    public int getMaxDetailEnrichmentsPerRun() {
        return Math.max(0, maxDetailEnrichmentsPerRun);
    }

    public void setMaxDetailEnrichmentsPerRun(int maxDetailEnrichmentsPerRun) {
        this.maxDetailEnrichmentsPerRun = Math.max(0, maxDetailEnrichmentsPerRun);
    }

    public int getInterRequestDelayMinMs() {
        return Math.max(0, interRequestDelayMinMs);
    }

    public void setInterRequestDelayMinMs(int interRequestDelayMinMs) {
        this.interRequestDelayMinMs = Math.max(0, interRequestDelayMinMs);
    }

    public int getInterRequestDelayMaxMs() {
        return Math.max(getInterRequestDelayMinMs(), interRequestDelayMaxMs);
    }

    public void setInterRequestDelayMaxMs(int interRequestDelayMaxMs) {
        this.interRequestDelayMaxMs = Math.max(0, interRequestDelayMaxMs);
    }

    public int getInterTileDelayMs() {
        return Math.max(0, interTileDelayMs);
    }

    public void setInterTileDelayMs(int interTileDelayMs) {
        this.interTileDelayMs = Math.max(0, interTileDelayMs);
    }

    public int getFullPageThreshold() {
        return Math.max(1, fullPageThreshold);
    }

    public void setFullPageThreshold(int fullPageThreshold) {
        this.fullPageThreshold = Math.max(1, fullPageThreshold);
    }

    public int getMaxPagesPerTile() {
        return Math.max(1, maxPagesPerTile);
    }

    public void setMaxPagesPerTile(int maxPagesPerTile) {
        this.maxPagesPerTile = Math.max(1, maxPagesPerTile);
    }

    public double getMaxTileSpanDegrees() {
        return maxTileSpanDegrees;
    }

    public void setMaxTileSpanDegrees(double maxTileSpanDegrees) {
        this.maxTileSpanDegrees = maxTileSpanDegrees > 0 ? maxTileSpanDegrees : 5.0;
    }

    public int getSessionRefreshEveryTiles() {
        return Math.max(0, sessionRefreshEveryTiles);
    }

    public void setSessionRefreshEveryTiles(int sessionRefreshEveryTiles) {
        this.sessionRefreshEveryTiles = Math.max(0, sessionRefreshEveryTiles);
    }

    public boolean isDetailBackfillEnabled() {
        return detailBackfillEnabled;
    }

    public void setDetailBackfillEnabled(boolean detailBackfillEnabled) {
        this.detailBackfillEnabled = detailBackfillEnabled;
    }

    public String getTileFile() {
        return tileFile;
    }

    public void setTileFile(String tileFile) {
        this.tileFile = tileFile;
    }

    public Region getRegion() {
        return region;
    }

    public void setRegion(Region region) {
        this.region = region;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Region {
        private double minLat = 20.0;
        private double maxLat = 37.5;
        private double minLng = -17.5;
        private double maxLng = -0.5;

        public double getMinLat() {
            return minLat;
        }

        public void setMinLat(double minLat) {
            this.minLat = minLat;
        }

        public double getMaxLat() {
            return maxLat;
        }

        public void setMaxLat(double maxLat) {
            this.maxLat = maxLat;
        }

        public double getMinLng() {
            return minLng;
        }

        public void setMinLng(double minLng) {
            this.minLng = minLng;
        }

        public double getMaxLng() {
            return maxLng;
        }

        public void setMaxLng(double maxLng) {
            this.maxLng = maxLng;
        }
    }

    public static class Provider {
        private String baseUrl = "https://www.airbnb.com";
        private String searchOperation = "StaysSearch";
        private String detailOperation = "StaysPdpSections";
        private String listingBaseUrl = "https://www.airbnb.com/rooms";
        private String query = "Morocco";
        private int itemsPerGrid = 18;
        private String currencyCode = "MAD";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = stripTrailingSlash(baseUrl);
        }

        public String getSearchOperation() {
            return searchOperation;
        }

        public void setSearchOperation(String searchOperation) {
            this.searchOperation = searchOperation;
        }

        public String getDetailOperation() {
            return detailOperation;
        }

        public void setDetailOperation(String detailOperation) {
            this.detailOperation = detailOperation;
        }

        public String getListingBaseUrl() {
            return listingBaseUrl;
        }

        public void setListingBaseUrl(String listingBaseUrl) {
            this.listingBaseUrl = stripTrailingSlash(listingBaseUrl);
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public int getItemsPerGrid() {
            return Math.max(1, itemsPerGrid);
        }

        public void setItemsPerGrid(int itemsPerGrid) {
            this.itemsPerGrid = Math.max(1, itemsPerGrid);
        }

        public String getCurrencyCode() {
            return currencyCode;
        }

        public void setCurrencyCode(String currencyCode) {
            this.currencyCode = currencyCode;
        }

        private static String stripTrailingSlash(String value) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            return trimmed;
        }
    }

    public static class Session {
        private String searchToken;
        private String itemToken;
        private String apiKey;
        private String clientVersion;
        private String clientRequestId;
        private String locale = "en";
        private String currency = "MAD";
        private int viewportWidthPx = 1400;
        private int viewportHeightPx = 900;
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getSearchToken() {
            return searchToken;
        }

        public void setSearchToken(String searchToken) {
            this.searchToken = searchToken;
        }

        public String getItemToken() {
            return itemToken;
        }

        public void setItemToken(String itemToken) {
            this.itemToken = itemToken;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getClientVersion() {
            return clientVersion;
        }

        public void setClientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
        }

        public String getClientRequestId() {
            return clientRequestId;
        }

        public void setClientRequestId(String clientRequestId) {
            this.clientRequestId = clientRequestId;
        }

        public String getLocale() {
            return locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        public int getViewportWidthPx() {
            return Math.max(1, viewportWidthPx);
        }

        public void setViewportWidthPx(int viewportWidthPx) {
            this.viewportWidthPx = Math.max(1, viewportWidthPx);
        }

        public int getViewportHeightPx() {
            return Math.max(1, viewportHeightPx);
        }

        public void setViewportHeightPx(int viewportHeightPx) {
            this.viewportHeightPx = Math.max(1, viewportHeightPx);
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers == null ? new LinkedHashMap<>() : headers;
        }
    }
}
