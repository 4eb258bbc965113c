package com.siteaudit.crawl.model;

import java.time.Instant;
import java.util.List;

public record MonitoringReport(
    Instant checkedAt,
    SiteStatus status,
    int totalPages,
    int changedPages,
    List<MonitoringDiff> diffs
) {
    public MonitoringReport {
        diffs = diffs == null ? List.of() : List.copyOf(diffs);
    }
}
