package com.siteaudit.crawl.model;

import java.util.List;
import java.util.Map;

public record AuditSummary(
    int siteScore,
    int crawledPages,
    int indexablePages,
    Map<Severity, Integer> issuesCount,
    Map<String, Map<Severity, Integer>> categories,
    List<Issue> topIssues
) {
}
