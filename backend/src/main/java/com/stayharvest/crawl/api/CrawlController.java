package com.stayharvest.crawl.api;

import com.stayharvest.crawl.model.CrawlRunSummary;
import com.stayharvest.crawl.model.CrawlStatsResponse;
import com.stayharvest.crawl.service.CrawlOrchestratorService;
import com.stayharvest.crawl.service.CrawlStateStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final CrawlStateStore crawlStateStore;

    public CrawlController(CrawlOrchestratorService crawlOrchestratorService, CrawlStateStore crawlStateStore) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.crawlStateStore = crawlStateStore;
    }

    @PostMapping("/crawl/run")
    public CrawlRunSummary run() {
        return crawlOrchestratorService.run();
    }

    @GetMapping("/crawl/stats")
    public CrawlStatsResponse stats() {
        return new CrawlStatsResponse(
            crawlStateStore.stats(),
            crawlStateStore.dataQuality(),
            crawlStateStore.getCursor(),
            crawlOrchestratorService.isRunning()
        );
    }

    @GetMapping("/crawl/cursor")
    public Map<String, Integer> cursor() {
        return Map.of("cursor", crawlStateStore.getCursor());
    }
}
