package com.siteaudit.crawl.model;

/**
 * One audit finding. {@code affectedPageCount} is 1 while a page is analyzed and is
 * backfilled by the aggregator once all pages of a run are known.
 */
public record Issue(
    String type,
    Severity severity,
    String category,
    String description,
    int affectedPageCount
) {
    public static final String CATEGORY_CRAWLABILITY = "crawlability";
    public static final String CATEGORY_META_TAGS = "meta_tags";
    public static final String CATEGORY_HEADINGS = "headings";

    public static Issue of(String type, Severity severity, String category, String description) {
        return new Issue(type, severity, category, description, 1);
    }

    public Issue withAffectedPageCount(int count) {
        return new Issue(type, severity, category, description, count);
    }

    public String key() {
        return category + ":" + type;
    }
}
