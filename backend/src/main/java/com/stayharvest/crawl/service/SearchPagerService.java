package com.stayharvest.crawl.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.extract.ListingValidator;
import com.stayharvest.crawl.extract.ResponseExtractor;
import com.stayharvest.crawl.http.FetchExhaustedException;
import com.stayharvest.crawl.http.ProviderRequestFactory;
import com.stayharvest.crawl.http.RetryingFetcher;
import com.stayharvest.crawl.model.DetailRecord;
import com.stayharvest.crawl.model.SearchPage;
import com.stayharvest.crawl.model.SearchRecord;
import com.stayharvest.crawl.model.SessionMaterial;
import com.stayharvest.crawl.model.Tile;
import com.stayharvest.crawl.model.TileCrawlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Walks the result pages of one tile, persisting each listing as it goes and enriching it while the
 * detail budget lasts.
 */
@Service
public class SearchPagerService {
    private static final Logger log = LoggerFactory.getLogger(SearchPagerService.class);

    private final HarvesterProperties properties;
    private final ProviderRequestFactory requestFactory;
    private final RetryingFetcher fetcher;
    private final ResponseExtractor extractor;
    private final ListingValidator validator;
    private final CrawlStateStore store;
    private final DetailEnrichmentService detailEnrichmentService;
    private final CrawlPacer pacer;

    public SearchPagerService(
        HarvesterProperties properties,
        ProviderRequestFactory requestFactory,
        RetryingFetcher fetcher,
        ResponseExtractor extractor,
        ListingValidator validator,
        CrawlStateStore store,
        DetailEnrichmentService detailEnrichmentService,
        CrawlPacer pacer
    ) {
        this.properties = properties;
        this.requestFactory = requestFactory;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.validator = validator;
        this.store = store;
        this.detailEnrichmentService = detailEnrichmentService;
        this.pacer = pacer;
    }

    public TileCrawlResult crawlTile(CrawlRunContext context, Tile tile, SessionMaterial session) {
        TileProgress progress = new TileProgress();
        String pageCursor = null;
        while (true) {
            if (context.isStopped()) {
                progress.interrupted = true;
                break;
            }
            JsonNode document;
            try {
                document = fetcher.fetchJson(requestFactory.searchRequest(session, tile, pageCursor));
            } catch (FetchExhaustedException e) {
                if (progress.pages == 0) {
                    log.warn("Abandoning tile {}: first page could not be fetched ({})", tile.ordinal(), e.getMessage());
                    return TileCrawlResult.abandoned(tile.ordinal());
                }
                log.warn("Ending tile {} after {} pages: {}", tile.ordinal(), progress.pages, e.getMessage());
                break;
            }
            SearchPage page = extractor.extract(document);
            progress.pages++;
            progress.found += page.records().size();
            context.addRecordsFound(page.records().size());
            log.info(
                "Tile {} page {}: {} listings, totalPages={}, deepScan={}",
                tile.ordinal(),
                progress.pages,
                page.records().size(),
                page.totalPages(),
                page.deepScanUsed()
            );

            for (SearchRecord record : page.records()) {
                if (context.newRecordBudgetReached()) {
                    context.stop(CrawlRunContext.STOP_NEW_RECORD_BUDGET);
                    progress.interrupted = true;
                    break;
                }
                processRecord(context, session, record, page.federatedSearchId(), progress);
                if (progress.interrupted) {
                    break;
                }
            }
            if (progress.interrupted) {
                break;
            }
            if (isLastPage(page, progress.pages)) {
                break;
            }
            pageCursor = page.nextCursor();
            if (!pacer.pauseBetweenRequests()) {
                context.stop(CrawlRunContext.STOP_INTERRUPTED);
                progress.interrupted = true;
                break;
            }
        }
        return new TileCrawlResult(
            tile.ordinal(),
            progress.pages > 0,
            progress.interrupted,
            progress.pages,
            progress.found,
            progress.basicSaved,
            progress.detailedSaved
        );
    }

    boolean isLastPage(SearchPage page, int pagesFetched) {
        if (page.nextCursor() == null) {
            return true;
        }
        if (page.records().size() < properties.getFullPageThreshold()) {
            return true;
        }
        if (page.totalPages() > 0 && pagesFetched >= page.totalPages()) {
            return true;
        }
        return pagesFetched >= properties.getMaxPagesPerTile();
    }

    private void processRecord(
        CrawlRunContext context,
        SessionMaterial session,
        SearchRecord record,
        String federatedSearchId,
        TileProgress progress
    ) {
        if (!validator.validate(record).valid()) {
            log.warn("Skipping invalid listing {}", record.id());
            return;
        }
        boolean touched = false;
        if (store.isRecordFresh(record.id())) {
            log.debug("Listing {} is fresh; not rewriting basic fields", record.id());
        } else {
            if (!context.reserveNewRecord()) {
                context.stop(CrawlRunContext.STOP_NEW_RECORD_BUDGET);
                progress.interrupted = true;
                return;
            }
            boolean saved;
            try {
                saved = store.upsertBasicRecord(record, Instant.now());
            } catch (DataAccessException e) {
                log.warn("Could not store listing {}; skipping it: {}", record.id(), e.getMessage());
                saved = false;
            }
            if (saved) {
                progress.basicSaved++;
                touched = true;
                log.info("Saved listing {} ({}/{} new this run)", record.id(), context.newRecords(), context.maxNewRecords());
            } else {
                context.releaseNewRecord();
            }
        }

        if (context.detailBudgetRemaining() && !store.isRecordDetailed(record.id())) {
            if (context.reserveDetailEnrichment()) {
                touched = true;
                Optional<DetailRecord> detail = detailEnrichmentService.enrich(
                    session,
                    record.id(),
                    record.toHints(federatedSearchId)
                );
                if (detail.isPresent() && applyDetail(record.id(), detail.get())) {
                    progress.detailedSaved++;
                    context.recordDetailedSaved();
                }
            }
        }

        if (touched && !pacer.pauseBetweenRequests()) {
            context.stop(CrawlRunContext.STOP_INTERRUPTED);
            progress.interrupted = true;
        }
    }

    private boolean applyDetail(String id, DetailRecord detail) {
        try {
            return store.applyDetailEnrichment(id, detail);
        } catch (DataAccessException e) {
            log.warn("Could not store detail for listing {}: {}", id, e.getMessage());
            return false;
        }
    }

    private static final class TileProgress {
        private int pages;
        private int found;
        private int basicSaved;
        private int detailedSaved;
        private boolean interrupted;
    }
}
