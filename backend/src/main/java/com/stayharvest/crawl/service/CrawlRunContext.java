package com.stayharvest.crawl.service;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable state of one crawl run, passed explicitly to every stage.
 * Budget counters only move through compare-and-set, so concurrent callers cannot overshoot a cap.
 */
public class CrawlRunContext {
    public static final String STOP_NEW_RECORD_BUDGET = "new_record_budget_reached";
    public static final String STOP_INTERRUPTED = "interrupted";

    private final int maxNewRecords;
    private final int maxDetailEnrichments;
    private final AtomicInteger newRecords = new AtomicInteger();
    private final AtomicInteger detailEnrichments = new AtomicInteger();
    private final AtomicInteger detailedSaved = new AtomicInteger();
    private final AtomicInteger recordsFound = new AtomicInteger();
    private final AtomicInteger tilesProcessed = new AtomicInteger();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicReference<String> stopReason = new AtomicReference<>();

    public CrawlRunContext(int maxNewRecords, int maxDetailEnrichments) {
        this.maxNewRecords = Math.max(0, maxNewRecords);
        this.maxDetailEnrichments = Math.max(0, maxDetailEnrichments);
    }

    public boolean newRecordBudgetReached() {
        return newRecords.get() >= maxNewRecords;
    }

    public boolean reserveNewRecord() {
        while (true) {
            int current = newRecords.get();
            if (current >= maxNewRecords) {
                return false;
            }
            if (newRecords.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releaseNewRecord() {
        newRecords.updateAndGet(current -> Math.max(0, current - 1));
    }

    public boolean detailBudgetRemaining() {
        return detailEnrichments.get() < maxDetailEnrichments;
    }

    public boolean reserveDetailEnrichment() {
        while (true) {
            int current = detailEnrichments.get();
            if (current >= maxDetailEnrichments) {
                return false;
            }
            if (detailEnrichments.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void stop(String reason) {
        if (stopped.compareAndSet(false, true)) {
            stopReason.set(reason);
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public String stopReason() {
        return stopReason.get();
    }

    public void addRecordsFound(int count) {
        recordsFound.addAndGet(Math.max(0, count));
    }

    public void recordDetailedSaved() {
        detailedSaved.incrementAndGet();
    }

    public void recordTileProcessed() {
        tilesProcessed.incrementAndGet();
    }

    public int newRecords() {
        return newRecords.get();
    }

    public int detailEnrichments() {
        return detailEnrichments.get();
    }

    public int detailedSaved() {
        return detailedSaved.get();
    }

    public int recordsFound() {
        return recordsFound.get();
    }

    public int tilesProcessed() {
        return tilesProcessed.get();
    }

    public int maxNewRecords() {
        return maxNewRecords;
    }

    public int maxDetailEnrichments() {
        return maxDetailEnrichments;
    }
}
