package com.siteaudit.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Result of fetching and analyzing one normalized URL. Created once per URL per crawl run.
 * {@code statusCode} is 0 when the fetch itself failed.
 */
public record PageRecord(
    String url,
    String finalUrl,
    int statusCode,
    String title,
    String metaDescription,
    List<String> h1,
    String canonicalUrl,
    String metaRobots,
    String contentType,
    long sizeBytes,
    int wordCount,
    boolean indexable,
    int score,
    int depth,
    List<PageLink> internalLinks,
    List<PageLink> externalLinks,
    List<Issue> issues
) {
    public PageRecord {
        h1 = h1 == null ? List.of() : List.copyOf(h1);
        internalLinks = internalLinks == null ? List.of() : List.copyOf(internalLinks);
        externalLinks = externalLinks == null ? List.of() : List.copyOf(externalLinks);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static PageRecord failed(String url, int statusCode, Issue issue) {
        return failed(url, null, statusCode, null, 0, issue);
    }

    public static PageRecord failed(
        String url,
        String finalUrl,
        int statusCode,
        String contentType,
        long sizeBytes,
        Issue issue
    ) {
        return new PageRecord(
            url,
            finalUrl,
            statusCode,
            null,
            null,
            List.of(),
            null,
            null,
            contentType,
            sizeBytes,
            0,
            false,
            0,
            0,
            List.of(),
            List.of(),
            List.of(issue)
        );
    }

    public PageRecord withDepth(int newDepth) {
        return new PageRecord(
            url,
            finalUrl,
            statusCode,
            title,
            metaDescription,
            h1,
            canonicalUrl,
            metaRobots,
            contentType,
            sizeBytes,
            wordCount,
            indexable,
            score,
            newDepth,
            internalLinks,
            externalLinks,
            issues
        );
    }

    public String firstH1() {
        return h1.isEmpty() ? null : h1.get(0);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean hasIssueWithSeverity(Severity severity) {
        for (Issue issue : issues) {
            if (issue.severity() == severity) {
                return true;
            }
        }
        return false;
    }
}
