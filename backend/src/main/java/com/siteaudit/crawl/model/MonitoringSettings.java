package com.siteaudit.crawl.model;

import java.time.Duration;

public record MonitoringSettings(
    int maxPages,
    int maxConcurrentFetches,
    Duration timeout,
    String userAgent
) {
    public static MonitoringSettings defaults() {
        return new MonitoringSettings(10, 3, Duration.ofSeconds(60), CrawlSettings.DEFAULT_USER_AGENT);
    }
}
