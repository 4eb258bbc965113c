package com.siteaudit.crawl.service;

import com.siteaudit.crawl.model.AuditSummary;
import com.siteaudit.crawl.model.CrawlReport;
import com.siteaudit.crawl.model.CrawlRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingCrawlRunListener implements CrawlRunListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingCrawlRunListener.class);

    @Override
    public void onRunFinished(CrawlReport report) {
        CrawlRun run = report.run();
        AuditSummary summary = report.summary();
        log.info(
            "Crawl run {} finished status={} cancelled={} seed={} crawled={} indexable={} score={} issues={} reason={}",
            run.runId(),
            run.status(),
            run.cancelled(),
            run.settings().seedUrl(),
            run.crawledPages(),
            run.indexablePages(),
            summary.siteScore(),
            summary.issuesCount(),
            run.failureReason()
        );
    }
}
