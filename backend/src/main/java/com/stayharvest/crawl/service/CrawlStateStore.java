package com.stayharvest.crawl.service;

import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.CrawlStats;
import com.stayharvest.crawl.model.DataQualityReport;
import com.stayharvest.crawl.model.DetailRecord;
import com.stayharvest.crawl.model.PendingDetail;
import com.stayharvest.crawl.model.SearchRecord;
import com.stayharvest.crawl.model.StoredRecordState;
import com.stayharvest.crawl.model.Tile;
import com.stayharvest.crawl.persistence.CrawlStateRepository;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable crawl state: the tile cursor, tile freshness and the two-phase listing records.
 * Every write is an idempotent upsert, so repeating a step after a crash is harmless.
 */
@Service
public class CrawlStateStore {
    private static final Duration RECENT_WINDOW = Duration.ofDays(1);

    private final CrawlStateRepository repository;
    private final HarvesterProperties properties;

    public CrawlStateStore(CrawlStateRepository repository, HarvesterProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public int getCursor() {
        Optional<Integer> cursor = repository.findCursor();
        if (cursor.isEmpty()) {
            repository.saveCursor(0);
            return 0;
        }
        return cursor.get();
    }

    public void setCursor(int value) {
        repository.saveCursor(value);
    }

    public boolean isTileFresh(int tileId) {
        return isTileFresh(tileId, Instant.now());
    }

    public boolean isTileFresh(int tileId, Instant now) {
        return repository.findTileLastScrapedAt(tileId)
            .map(lastScrapedAt -> isWithin(lastScrapedAt, now, properties.getTileFreshnessWindowDays()))
            .orElse(false);
    }

    public void recordTileScrape(Tile tile, int recordCount, Instant timestamp) {
        repository.upsertTile(tile, recordCount, timestamp.getEpochSecond());
    }

    public boolean isRecordFresh(String id) {
        return isRecordFresh(id, Instant.now());
    }

    public boolean isRecordFresh(String id, Instant now) {
        return repository.findRecordState(id)
            .map(state -> isWithin(state.lastScrapedAt().getEpochSecond(), now, properties.getRecordFreshnessWindowDays()))
            .orElse(false);
    }

    public boolean isRecordDetailed(String id) {
        return isRecordDetailed(id, Instant.now());
    }

    public boolean isRecordDetailed(String id, Instant now) {
        Optional<StoredRecordState> state = repository.findRecordState(id);
        return state.isPresent()
            && state.get().detailComplete()
            && isWithin(state.get().lastScrapedAt().getEpochSecond(), now, properties.getRecordFreshnessWindowDays());
    }

    public boolean upsertBasicRecord(SearchRecord record, Instant timestamp) {
        return repository.upsertRecord(record, null, false, timestamp.getEpochSecond());
    }

    public boolean upsertDetailedRecord(SearchRecord record, DetailRecord detail, Instant timestamp) {
        return repository.upsertRecord(record, detail, true, timestamp.getEpochSecond());
    }

    public boolean applyDetailEnrichment(String id, DetailRecord detail) {
        return repository.applyDetail(id, detail);
    }

    public List<PendingDetail> findRecordsNeedingDetail(int limit) {
        return repository.findPendingDetail(limit);
    }

    public CrawlStats stats() {
        return stats(Instant.now());
    }

    public CrawlStats stats(Instant now) {
        return new CrawlStats(
            repository.countRecords(),
            repository.countRecordsByDetail(false),
            repository.countRecordsByDetail(true),
            repository.countPendingDetail(),
            repository.countTiles(),
            repository.countRecordsScrapedSince(now.minus(RECENT_WINDOW).getEpochSecond())
        );
    }

    public DataQualityReport dataQuality() {
        return repository.dataQuality();
    }

    private static boolean isWithin(long lastScrapedAtEpochSeconds, Instant now, int windowDays) {
        long age = now.getEpochSecond() - lastScrapedAtEpochSeconds;
        return age < Duration.ofDays(windowDays).getSeconds();
    }
}
