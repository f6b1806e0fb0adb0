package com.stayharvest.crawl.service;

import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.geo.TileBoundsValidator;
import com.stayharvest.crawl.geo.TileSourceLoader;
import com.stayharvest.crawl.model.CrawlRunSummary;
import com.stayharvest.crawl.model.CrawlStats;
import com.stayharvest.crawl.model.DataQualityReport;
import com.stayharvest.crawl.model.DetailHints;
import com.stayharvest.crawl.model.DetailRecord;
import com.stayharvest.crawl.model.PendingDetail;
import com.stayharvest.crawl.model.SessionMaterial;
import com.stayharvest.crawl.model.Tile;
import com.stayharvest.crawl.model.TileCrawlResult;
import com.stayharvest.crawl.session.SessionMaterialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one incremental crawl run: resumes from the persisted tile cursor, skips fresh or implausible
 * tiles, pages through the rest and moves the cursor forward after every tile it finishes.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    static final String STATUS_COMPLETED = "COMPLETED";
    static final String STATUS_STOPPED = "STOPPED";
    static final String STATUS_FAILED = "FAILED";
    static final String STOP_MISSING_SEARCH_TOKEN = "missing_search_token";

    private final HarvesterProperties properties;
    private final CrawlStateStore store;
    private final SearchPagerService searchPagerService;
    private final DetailEnrichmentService detailEnrichmentService;
    private final SessionMaterialProvider sessionMaterialProvider;
    private final TileSourceLoader tileSourceLoader;
    private final TileBoundsValidator tileBoundsValidator;
    private final CrawlPacer pacer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant runStartedAt;

    public CrawlOrchestratorService(
        HarvesterProperties properties,
        CrawlStateStore store,
        SearchPagerService searchPagerService,
        DetailEnrichmentService detailEnrichmentService,
        SessionMaterialProvider sessionMaterialProvider,
        TileSourceLoader tileSourceLoader,
        TileBoundsValidator tileBoundsValidator,
        CrawlPacer pacer
    ) {
        this.properties = properties;
        this.store = store;
        this.searchPagerService = searchPagerService;
        this.detailEnrichmentService = detailEnrichmentService;
        this.sessionMaterialProvider = sessionMaterialProvider;
        this.tileSourceLoader = tileSourceLoader;
        this.tileBoundsValidator = tileBoundsValidator;
        this.pacer = pacer;
    }

    public CrawlRunSummary run() {
        ensureNoActiveRun();
        try {
            return execute(tileSourceLoader.load());
        } finally {
            releaseRun();
        }
    }

    public CrawlRunSummary run(List<Tile> tiles) {
        ensureNoActiveRun();
        try {
            return execute(tiles);
        } finally {
            releaseRun();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private CrawlRunSummary execute(List<Tile> tiles) {
        Instant startedAt = Instant.now();
        CrawlRunContext context = new CrawlRunContext(
            properties.getMaxNewRecordsPerRun(),
            properties.getMaxDetailEnrichmentsPerRun()
        );
        logStats("Starting crawl run", store.stats());

        int cursor = store.getCursor();
        if (cursor < 0 || cursor >= tiles.size()) {
            if (cursor != 0) {
                log.info("Cursor {} is past the {} known tiles; starting over at 0", cursor, tiles.size());
            }
            cursor = 0;
            store.setCursor(0);
        }
        int end = Math.min(cursor + properties.getTilesPerRun(), tiles.size());
        log.info("Remaining tiles this run: {} (from {} of {})", end - cursor, cursor, tiles.size());

        SessionMaterial session = sessionMaterialProvider.current();
        if (!session.hasSearchToken()) {
            log.error("No search capability token configured; nothing can be crawled");
            return finish(startedAt, context, STATUS_FAILED, cursor, STOP_MISSING_SEARCH_TOKEN);
        }

        int basicSaved = 0;
        int crawledTiles = 0;
        int refreshEvery = properties.getSessionRefreshEveryTiles();
        for (int index = cursor; index < end; index++) {
            if (context.newRecordBudgetReached()) {
                context.stop(CrawlRunContext.STOP_NEW_RECORD_BUDGET);
            }
            if (context.isStopped()) {
                break;
            }
            Tile tile = tiles.get(index);

            Optional<String> rejection = tileBoundsValidator.rejectionReason(tile);
            if (rejection.isPresent()) {
                log.warn("Skipping implausible tile {} {}: {}", tile.ordinal(), tile.describe(), rejection.get());
                cursor = advance(index);
                continue;
            }
            if (store.isTileFresh(tile.ordinal())) {
                log.info("Skipping tile {} {}: scraped within the freshness window", tile.ordinal(), tile.describe());
                cursor = advance(index);
                continue;
            }

            crawledTiles++;
            if (refreshEvery > 0 && crawledTiles % refreshEvery == 0) {
                log.info("Refreshing session material after {} tiles", crawledTiles);
                session = sessionMaterialProvider.refresh();
            }

            log.info("Scraping tile {} {}", tile.ordinal(), tile.describe());
            TileCrawlResult result;
            try {
                result = searchPagerService.crawlTile(context, tile, session);
            } catch (RuntimeException e) {
                log.warn("Tile {} failed unexpectedly; moving on", tile.ordinal(), e);
                result = TileCrawlResult.abandoned(tile.ordinal());
            }
            basicSaved += result.basicSaved();
            context.recordTileProcessed();

            if (result.interrupted()) {
                if (result.fetched() && CrawlRunContext.STOP_NEW_RECORD_BUDGET.equals(context.stopReason())) {
                    store.recordTileScrape(tile, result.recordsFound(), Instant.now());
                    cursor = advance(index);
                    log.info(
                        "New-record budget reached on tile {} after {} listings; tile recorded, cursor moves to {}",
                        tile.ordinal(),
                        result.recordsFound(),
                        cursor
                    );
                } else {
                    log.info(
                        "Tile {} interrupted ({}); cursor stays at {} so the next run resumes here",
                        tile.ordinal(),
                        context.stopReason(),
                        index
                    );
                    cursor = index;
                }
                break;
            }
            if (result.fetched()) {
                store.recordTileScrape(tile, result.recordsFound(), Instant.now());
                log.info(
                    "Tile {} completed - found: {}, basic saved: {}, detailed saved: {}",
                    tile.ordinal(),
                    result.recordsFound(),
                    result.basicSaved(),
                    result.detailedSaved()
                );
            }
            cursor = advance(index);
            if (index + 1 < end && !pacer.pauseBetweenTiles()) {
                context.stop(CrawlRunContext.STOP_INTERRUPTED);
            }
        }

        if (properties.isDetailBackfillEnabled() && !CrawlRunContext.STOP_INTERRUPTED.equals(context.stopReason())) {
            backfillDetails(context, session);
        }
        String status = context.isStopped() ? STATUS_STOPPED : STATUS_COMPLETED;
        return finish(startedAt, context, status, cursor, context.stopReason(), basicSaved);
    }

    private void backfillDetails(CrawlRunContext context, SessionMaterial session) {
        int remaining = context.maxDetailEnrichments() - context.detailEnrichments();
        if (remaining <= 0) {
            return;
        }
        List<PendingDetail> pending = store.findRecordsNeedingDetail(remaining);
        log.info("Backfilling details for {} pending listings", pending.size());
        for (PendingDetail record : pending) {
            if (!context.reserveDetailEnrichment()) {
                break;
            }
            Optional<DetailRecord> detail = detailEnrichmentService.enrich(
                session,
                record.id(),
                DetailHints.forLink(record.link(), record.title())
            );
            if (detail.isPresent() && applyDetail(record.id(), detail.get())) {
                context.recordDetailedSaved();
            }
            if (!pacer.pauseBetweenRequests()) {
                context.stop(CrawlRunContext.STOP_INTERRUPTED);
                break;
            }
        }
    }

    private boolean applyDetail(String id, DetailRecord detail) {
        try {
            return store.applyDetailEnrichment(id, detail);
        } catch (DataAccessException e) {
            log.warn("Could not store backfilled detail for listing {}: {}", id, e.getMessage());
            return false;
        }
    }

    private int advance(int index) {
        int next = index + 1;
        store.setCursor(next);
        return next;
    }

    private CrawlRunSummary finish(Instant startedAt, CrawlRunContext context, String status, int cursor, String stopReason) {
        return finish(startedAt, context, status, cursor, stopReason, 0);
    }

    private CrawlRunSummary finish(
        Instant startedAt,
        CrawlRunContext context,
        String status,
        int cursor,
        String stopReason,
        int basicSaved
    ) {
        CrawlRunSummary summary = new CrawlRunSummary(
            startedAt,
            Instant.now(),
            status,
            context.tilesProcessed(),
            context.recordsFound(),
            basicSaved,
            context.detailedSaved(),
            cursor,
            stopReason
        );
        log.info(
            "Crawl run {}: tiles={}, found={}, basicSaved={}, detailedSaved={}, cursor={}, stopReason={}",
            status,
            summary.tilesProcessed(),
            summary.recordsFound(),
            summary.basicSaved(),
            summary.detailedSaved(),
            summary.cursor(),
            stopReason
        );
        logStats("Final statistics", store.stats());
        logDataQuality(store.dataQuality());
        return summary;
    }

    private void logStats(String label, CrawlStats stats) {
        log.info(
            "{} - total: {}, basic only: {}, detailed: {}, pending detail: {}, tiles processed: {}, recent (24h): {}",
            label,
            stats.total(),
            stats.basicOnly(),
            stats.detailed(),
            stats.pendingDetail(),
            stats.tilesProcessed(),
            stats.recentCount()
        );
    }

    private void logDataQuality(DataQualityReport report) {
        log.info(
            "Data quality - with price: {}/{} ({}%), with picture: {}/{} ({}%), with coordinates: {}/{} ({}%)",
            report.withPrice(),
            report.total(),
            percent(report.ratio(report.withPrice())),
            report.withPicture(),
            report.total(),
            percent(report.ratio(report.withPicture())),
            report.withCoordinates(),
            report.total(),
            percent(report.ratio(report.withCoordinates()))
        );
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f", ratio * 100);
    }

    private void ensureNoActiveRun() {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveCrawlRunException(runStartedAt);
        }
        runStartedAt = Instant.now();
    }

    private void releaseRun() {
        runStartedAt = null;
        running.set(false);
    }
}
