package com.siteaudit.crawl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Roll-up of the monitoring checks taken since {@code since}. {@code changesByType} always has
 * the keys {@code content}, {@code meta} and {@code status}.
 */
public record MonitoringSummary(
    Instant since,
    int totalChecks,
    double uptimePercentage,
    int totalChanges,
    Map<String, Integer> changesByType,
    List<PageChangeCount> mostChangedPages
) {
    public static final String CONTENT = "content";
    public static final String META = "meta";
    public static final String STATUS = "status";

    public MonitoringSummary {
        changesByType = changesByType == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(changesByType));
        mostChangedPages = mostChangedPages == null ? List.of() : List.copyOf(mostChangedPages);
    }

    public record PageChangeCount(String url, int changesCount) {
    }
}
