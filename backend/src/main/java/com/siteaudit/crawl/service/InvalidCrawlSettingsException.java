package com.siteaudit.crawl.service;

import java.util.List;

/**
 * Thrown by {@link CrawlScheduler#start} before any run state exists. Carries every rule the
 * settings broke, not only the first.
 */
public class InvalidCrawlSettingsException extends RuntimeException {
    private final List<String> violations;

    public InvalidCrawlSettingsException(List<String> violations) {
        super("Invalid crawl settings: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
