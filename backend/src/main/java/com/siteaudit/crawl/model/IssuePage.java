package com.siteaudit.crawl.model;

import java.util.List;

public record IssuePage(
    List<Issue> items,
    int page,
    int pageSize,
    int totalItems,
    int totalPages
) {
}
