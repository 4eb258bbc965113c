package com.siteaudit.crawl.model;

import java.util.List;

/**
 * Everything a caller persists after a run: final run metadata, every page record and the
 * aggregated summary.
 */
public record CrawlReport(
    CrawlRun run,
    List<PageRecord> pages,
    AuditSummary summary
) {
    public CrawlReport {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
