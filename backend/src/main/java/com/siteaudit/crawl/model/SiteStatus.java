package com.siteaudit.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SiteStatus {
    UP,
    ISSUES,
    DOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
