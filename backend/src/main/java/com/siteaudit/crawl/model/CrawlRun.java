package com.siteaudit.crawl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of one crawl run. While the run is in progress only the counters move; the score
 * and severity summary are filled in when the run reaches a terminal status.
 */
public record CrawlRun(
    UUID runId,
    CrawlSettings settings,
    Instant startedAt,
    Instant finishedAt,
    CrawlRunStatus status,
    boolean cancelled,
    String failureReason,
    int totalPages,
    int crawledPages,
    int indexablePages,
    Integer siteScore,
    Map<Severity, Integer> issuesCount
) {
    public CrawlRun {
        issuesCount = issuesCount == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(issuesCount));
    }

    public Double progressPercentage() {
        if (status != CrawlRunStatus.IN_PROGRESS || totalPages <= 0) {
            return null;
        }
        return Math.round((crawledPages * 100.0 / totalPages) * 100.0) / 100.0;
    }
}
