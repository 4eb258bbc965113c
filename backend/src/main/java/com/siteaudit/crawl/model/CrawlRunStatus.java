package com.siteaudit.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CrawlRunStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return wireName();
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
