package com.siteaudit.crawl.service;

import com.siteaudit.crawl.model.CrawlReport;

/**
 * Notified once per run after it reached a terminal status and the summary was computed.
 */
public interface CrawlRunListener {
    void onRunFinished(CrawlReport report);
}
