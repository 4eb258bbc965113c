package com.siteaudit.crawl.model;

import java.util.List;

/**
 * Changes between a stored page record and a fresh fetch of the same URL. Null members mean
 * "no change of that kind".
 */
public record MonitoringDiff(
    String url,
    ContentChange contentChange,
    List<MetaChange> metaChanges,
    StatusChange statusChange
) {
    public MonitoringDiff {
        metaChanges = metaChanges == null ? List.of() : List.copyOf(metaChanges);
    }

    public boolean hasChanges() {
        return contentChange != null || statusChange != null || !metaChanges.isEmpty();
    }

    public record ContentChange(int oldWordCount, int newWordCount, double changePercentage) {
    }

    public record MetaChange(String field, String oldValue, String newValue) {
    }

    public record StatusChange(int oldStatus, int newStatus, String error) {
    }
}
