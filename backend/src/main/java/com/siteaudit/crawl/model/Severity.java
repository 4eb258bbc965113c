package com.siteaudit.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    CRITICAL,
    WARNING,
    OPPORTUNITY,
    NOTICE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return wireName();
    }

    /**
     * Critical and warning issues are the ones surfaced first in issue rankings.
     */
    public boolean isPriority() {
        return this == CRITICAL || this == WARNING;
    }
}
