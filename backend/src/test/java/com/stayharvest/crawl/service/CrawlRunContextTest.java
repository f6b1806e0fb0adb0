package com.stayharvest.crawl.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlRunContextTest {

    @Test
    void reservationsNeverExceedTheCap() throws Exception {
        CrawlRunContext context = new CrawlRunContext(25, 0);
        AtomicInteger granted = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 200; i++) {
                executor.submit(() -> {
                    start.await();
                    if (context.reserveNewRecord()) {
                        granted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(25, granted.get());
        assertEquals(25, context.newRecords());
        assertTrue(context.newRecordBudgetReached());
    }

    @Test
    void releasedReservationCanBeReused() {
        CrawlRunContext context = new CrawlRunContext(1, 1);

        assertTrue(context.reserveNewRecord());
        assertFalse(context.reserveNewRecord());
        context.releaseNewRecord();
        assertTrue(context.reserveNewRecord());

        assertTrue(context.reserveDetailEnrichment());
        assertFalse(context.detailBudgetRemaining());
        assertFalse(context.reserveDetailEnrichment());
    }

    @Test
    void firstStopReasonWins() {
        CrawlRunContext context = new CrawlRunContext(3, 3);

        context.stop(CrawlRunContext.STOP_NEW_RECORD_BUDGET);
        context.stop(CrawlRunContext.STOP_INTERRUPTED);

        assertTrue(context.isStopped());
        assertEquals(CrawlRunContext.STOP_NEW_RECORD_BUDGET, context.stopReason());
    }

    @Test
    void zeroBudgetIsReachedImmediately() {
        CrawlRunContext context = new CrawlRunContext(0, -4);

        assertTrue(context.newRecordBudgetReached());
        assertFalse(context.reserveNewRecord());
        assertEquals(0, context.maxDetailEnrichments());
    }
}
