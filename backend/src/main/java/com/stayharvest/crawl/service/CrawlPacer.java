package com.stayharvest.crawl.service;

import com.stayharvest.config.HarvesterProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Spaces provider requests out. Returns false when the wait was interrupted; the interrupt flag is restored.
 */
@Component
public class CrawlPacer {
    private final HarvesterProperties properties;

    public CrawlPacer(HarvesterProperties properties) {
        this.properties = properties;
    }

    public boolean pauseBetweenRequests() {
        int min = properties.getInterRequestDelayMinMs();
        int max = properties.getInterRequestDelayMaxMs();
        long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1L) : min;
        return sleep(delay);
    }

    public boolean pauseBetweenTiles() {
        return sleep(properties.getInterTileDelayMs());
    }

    private boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
