package com.siteaudit.crawl.service;

import com.siteaudit.config.CrawlerProperties;
import com.siteaudit.crawl.http.PageFetcher;
import com.siteaudit.crawl.model.FetchResult;
import com.siteaudit.crawl.model.Issue;
import com.siteaudit.crawl.model.MonitoringDiff;
import com.siteaudit.crawl.model.MonitoringReport;
import com.siteaudit.crawl.model.MonitoringSettings;
import com.siteaudit.crawl.model.PageRecord;
import com.siteaudit.crawl.model.Severity;
import com.siteaudit.crawl.model.SiteStatus;
import com.siteaudit.crawl.page.PageAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Re-fetches the best pages of a finished audit and reports what changed since.
 */
@Service
public class MonitoringService {
    private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

    private final PageFetcher fetcher;
    private final PageAnalyzer analyzer;
    private final MonitoringDiffer differ;
    private final CrawlerProperties properties;

    public MonitoringService(PageFetcher fetcher, PageAnalyzer analyzer, MonitoringDiffer differ, CrawlerProperties properties) {
        this.fetcher = fetcher;
        this.analyzer = analyzer;
        this.differ = differ;
        this.properties = properties;
    }

    public MonitoringReport check(List<PageRecord> baseline) {
        return check(baseline, properties.newMonitoringSettings());
    }

    /**
     * @throws IllegalArgumentException if the baseline has no indexable page
     */
    public MonitoringReport check(List<PageRecord> baseline, MonitoringSettings settings) {
        List<PageRecord> targets = selectTargets(baseline, settings.maxPages());
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("No indexable pages to monitor");
        }
        int poolSize = Math.max(1, Math.min(settings.maxConcurrentFetches(), targets.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        List<MonitoringDiff> diffs = new ArrayList<>(targets.size());
        try {
            List<CompletableFuture<MonitoringDiff>> futures = new ArrayList<>(targets.size());
            for (PageRecord target : targets) {
                futures.add(CompletableFuture.supplyAsync(() -> checkPage(target, settings), pool));
            }
            for (CompletableFuture<MonitoringDiff> future : futures) {
                diffs.add(future.join());
            }
        } finally {
            pool.shutdownNow();
        }

        SiteStatus status = differ.siteStatus(diffs);
        int changed = 0;
        for (MonitoringDiff diff : diffs) {
            if (diff.hasChanges()) {
                changed++;
            }
        }
        log.info("Monitoring check finished status={} pages={} changed={}", status, targets.size(), changed);
        return new MonitoringReport(Instant.now(), status, targets.size(), changed, diffs);
    }

    /**
     * Indexable pages with the highest scores first; ties keep baseline order.
     */
    static List<PageRecord> selectTargets(List<PageRecord> baseline, int maxPages) {
        List<PageRecord> indexable = new ArrayList<>();
        if (baseline != null) {
            for (PageRecord page : baseline) {
                if (page.indexable()) {
                    indexable.add(page);
                }
            }
        }
        indexable.sort(Comparator.comparingInt(PageRecord::score).reversed());
        return indexable.size() > maxPages ? List.copyOf(indexable.subList(0, maxPages)) : List.copyOf(indexable);
    }

    private MonitoringDiff checkPage(PageRecord baseline, MonitoringSettings settings) {
        PageRecord fresh;
        try {
            FetchResult result = fetcher.fetch(baseline.url(), settings.timeout(), settings.userAgent());
            fresh = analyzer.analyze(baseline.url(), result);
        } catch (RuntimeException e) {
            log.warn("Monitoring check failed for {}", baseline.url(), e);
            fresh = PageRecord.failed(baseline.url(), 0, Issue.of(
                "fetch_error",
                Severity.CRITICAL,
                Issue.CATEGORY_CRAWLABILITY,
                "Error fetching the page: " + e.getMessage()
            ));
        }
        return differ.diff(baseline, fresh);
    }
}
