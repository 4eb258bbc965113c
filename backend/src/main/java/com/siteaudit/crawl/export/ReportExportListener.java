package com.siteaudit.crawl.export;

import com.siteaudit.config.ExportProperties;
import com.siteaudit.crawl.model.CrawlReport;
import com.siteaudit.crawl.service.CrawlRunListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConditionalOnProperty(prefix = "site-audit.export", name = "directory")
public class ReportExportListener implements CrawlRunListener {
    private static final Logger log = LoggerFactory.getLogger(ReportExportListener.class);

    private final CrawlReportJsonWriter writer;
    private final ExportProperties properties;

    public ReportExportListener(CrawlReportJsonWriter writer, ExportProperties properties) {
        this.writer = writer;
        this.properties = properties;
    }

    @Override
    public void onRunFinished(CrawlReport report) {
        if (properties.getDirectory() == null) {
            return;
        }
        Path written = writer.write(report, Path.of(properties.getDirectory()), properties.isPrettyPrint());
        log.info("Exported crawl run {} to {}", report.run().runId(), written);
    }
}
